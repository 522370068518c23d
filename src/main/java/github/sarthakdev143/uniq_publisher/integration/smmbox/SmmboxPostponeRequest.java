package github.sarthakdev143.uniq_publisher.integration.smmbox;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

import java.util.List;

/**
 * Body of {@code POST v1/posts/postpone}.
 */
public class SmmboxPostponeRequest extends GenericJson {

    @Key
    private List<SmmboxPost> posts;

    public List<SmmboxPost> getPosts() {
        return posts;
    }

    public SmmboxPostponeRequest setPosts(List<SmmboxPost> posts) {
        this.posts = posts;
        return this;
    }
}
