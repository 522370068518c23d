package github.sarthakdev143.uniq_publisher.model;

public record BatchFailure(
        String accountId,
        Platform platform,
        FailureReason reason,
        String message) {

    public static BatchFailure of(AccountTarget target, FailureReason reason, String message) {
        return new BatchFailure(target.accountId(), target.platform(), reason, message);
    }
}
