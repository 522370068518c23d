package github.sarthakdev143.uniq_publisher.model;

public enum BatchState {
    QUEUED,
    UNIQUEIZING,
    PUBLISHING,
    COMPLETED,
    FAILED,
    CANCELLED
}
