package github.sarthakdev143.uniq_publisher.integration.smmbox;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

public class SmmboxAttachment extends GenericJson {

    @Key
    private String type;

    @Key
    private String text;

    @Key
    private String url;

    public static SmmboxAttachment text(String text) {
        return new SmmboxAttachment().setType("text").setText(text);
    }

    public static SmmboxAttachment video(String url) {
        return new SmmboxAttachment().setType("video").setUrl(url);
    }

    public String getType() {
        return type;
    }

    public SmmboxAttachment setType(String type) {
        this.type = type;
        return this;
    }

    public String getText() {
        return text;
    }

    public SmmboxAttachment setText(String text) {
        this.text = text;
        return this;
    }

    public String getUrl() {
        return url;
    }

    public SmmboxAttachment setUrl(String url) {
        this.url = url;
        return this;
    }
}
