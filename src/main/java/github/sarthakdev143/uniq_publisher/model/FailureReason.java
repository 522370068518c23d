package github.sarthakdev143.uniq_publisher.model;

public enum FailureReason {
    UNIQUEIZATION_FAILED,
    PUBLISH_REJECTED,
    PUBLISH_TRANSIENT_EXHAUSTED,
    CANCELLED
}
