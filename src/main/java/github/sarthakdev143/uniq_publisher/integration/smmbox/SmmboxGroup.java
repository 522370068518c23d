package github.sarthakdev143.uniq_publisher.integration.smmbox;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

public class SmmboxGroup extends GenericJson {

    @Key
    private String id;

    @Key
    private String social;

    @Key
    private String type;

    public String getId() {
        return id;
    }

    public SmmboxGroup setId(String id) {
        this.id = id;
        return this;
    }

    public String getSocial() {
        return social;
    }

    public SmmboxGroup setSocial(String social) {
        this.social = social;
        return this;
    }

    public String getType() {
        return type;
    }

    public SmmboxGroup setType(String type) {
        this.type = type;
        return this;
    }
}
