package github.sarthakdev143.uniq_publisher.integration.smmbox;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

import java.util.List;
import java.util.Map;

/**
 * Provider envelope: {@code {"success": bool, "response": {...}, "error": ...}}. The error member is
 * either a string or an object with a {@code message}, so it is read from the generic map.
 */
public class SmmboxPostponeResponse extends GenericJson {

    @Key
    private Boolean success;

    @Key
    private Result response;

    public boolean isSuccess() {
        return Boolean.TRUE.equals(success);
    }

    public Result getResponse() {
        return response;
    }

    /**
     * First post id returned by the provider, or {@code null}.
     */
    public String firstPostId() {
        if (response == null || response.getPosts() == null || response.getPosts().isEmpty()) {
            return null;
        }
        Object id = response.getPosts().get(0).get("id");
        return id == null ? null : id.toString();
    }

    public String errorMessage() {
        return describeError(get("error"));
    }

    static String describeError(Object error) {
        if (error == null) {
            return "Unknown SmmBox error.";
        }
        if (error instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) error;
            Object message = map.get("message");
            return message != null ? message.toString() : map.toString();
        }
        return error.toString();
    }

    public static class Result extends GenericJson {

        @Key
        private List<GenericJson> posts;

        public List<GenericJson> getPosts() {
            return posts;
        }
    }
}
