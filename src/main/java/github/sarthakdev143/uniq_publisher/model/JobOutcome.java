package github.sarthakdev143.uniq_publisher.model;

public record JobOutcome(
        AccountTarget target,
        PublishJobState state,
        int attempts,
        String providerPostId,
        FailureReason failureReason,
        String message) {

    public JobOutcome {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("Job outcome requires a terminal state, got " + state + ".");
        }
    }

    public static JobOutcome succeeded(PublishJob job) {
        return new JobOutcome(job.target(), PublishJobState.SUCCEEDED, job.attempts(), job.providerPostId(), null, null);
    }

    public static JobOutcome failed(PublishJob job, FailureReason reason) {
        return new JobOutcome(job.target(), PublishJobState.FAILED, job.attempts(), null, reason, job.lastError());
    }

    public static JobOutcome cancelled(PublishJob job) {
        return new JobOutcome(
                job.target(),
                PublishJobState.CANCELLED,
                job.attempts(),
                null,
                FailureReason.CANCELLED,
                "Batch cancelled before the job was dispatched.");
    }

    public boolean isSucceeded() {
        return state == PublishJobState.SUCCEEDED;
    }
}
