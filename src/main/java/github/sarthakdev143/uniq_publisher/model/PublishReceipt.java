package github.sarthakdev143.uniq_publisher.model;

public record PublishReceipt(String providerPostId, String warningMessage) {

    public PublishReceipt(String providerPostId) {
        this(providerPostId, null);
    }
}
