package github.sarthakdev143.uniq_publisher.integration.smmbox;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

import java.util.List;

public class SmmboxPost extends GenericJson {

    @Key
    private SmmboxGroup group;

    @Key
    private List<SmmboxAttachment> attachments;

    /**
     * Publish time as unix epoch seconds.
     */
    @Key
    private Long date;

    public SmmboxGroup getGroup() {
        return group;
    }

    public SmmboxPost setGroup(SmmboxGroup group) {
        this.group = group;
        return this;
    }

    public List<SmmboxAttachment> getAttachments() {
        return attachments;
    }

    public SmmboxPost setAttachments(List<SmmboxAttachment> attachments) {
        this.attachments = attachments;
        return this;
    }

    public Long getDate() {
        return date;
    }

    public SmmboxPost setDate(Long date) {
        this.date = date;
        return this;
    }
}
