package github.sarthakdev143.uniq_publisher.model;

public enum PublishJobState {
    PENDING,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
