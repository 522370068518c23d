package github.sarthakdev143.uniq_publisher.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pairs one account with the variant made for it. Retries resend this same instance, so a batch never
 * holds two jobs for the same account.
 *
 * <p>State moves {@code PENDING -> IN_FLIGHT -> SUCCEEDED | FAILED} or {@code PENDING -> CANCELLED}.
 * Every transition is a compare-and-set; an illegal transition returns {@code false} and leaves the
 * state untouched.
 */
public final class PublishJob {

    private final String jobId;
    private final AccountTarget target;
    private final Variant variant;
    private final String mediaUrl;
    private final String caption;
    private final Instant scheduledAt;
    private final AtomicReference<PublishJobState> state = new AtomicReference<>(PublishJobState.PENDING);
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile String providerPostId;
    private volatile String lastError;

    public PublishJob(
            String jobId,
            Variant variant,
            String mediaUrl,
            String caption,
            Instant scheduledAt) {
        if (variant == null) {
            throw new IllegalArgumentException("variant is required.");
        }
        if (mediaUrl == null || mediaUrl.isBlank()) {
            throw new IllegalArgumentException("mediaUrl is required.");
        }
        if (scheduledAt == null) {
            throw new IllegalArgumentException("scheduledAt is required.");
        }
        this.jobId = jobId;
        this.target = variant.target();
        this.variant = variant;
        this.mediaUrl = mediaUrl;
        this.caption = caption == null || caption.isBlank() ? null : caption.trim();
        this.scheduledAt = scheduledAt;
    }

    public String jobId() {
        return jobId;
    }

    public AccountTarget target() {
        return target;
    }

    public Variant variant() {
        return variant;
    }

    public PublishJobState state() {
        return state.get();
    }

    public int attempts() {
        return attempts.get();
    }

    public String providerPostId() {
        return providerPostId;
    }

    public String lastError() {
        return lastError;
    }

    public PublishRequest toRequest() {
        return new PublishRequest(target, mediaUrl, caption, scheduledAt);
    }

    public boolean markInFlight() {
        return state.compareAndSet(PublishJobState.PENDING, PublishJobState.IN_FLIGHT);
    }

    /**
     * Counts a send. Only valid while the job is in flight.
     *
     * @return the 1-based attempt number
     */
    public int recordAttempt() {
        if (state.get() != PublishJobState.IN_FLIGHT) {
            throw new IllegalStateException("Job " + jobId + " is not in flight.");
        }
        return attempts.incrementAndGet();
    }

    public void recordError(String message) {
        this.lastError = message;
    }

    public boolean markSucceeded(String postId) {
        if (state.compareAndSet(PublishJobState.IN_FLIGHT, PublishJobState.SUCCEEDED)) {
            this.providerPostId = postId;
            return true;
        }
        return false;
    }

    public boolean markFailed(String message) {
        if (state.compareAndSet(PublishJobState.IN_FLIGHT, PublishJobState.FAILED)) {
            this.lastError = message;
            return true;
        }
        return false;
    }

    public boolean cancel() {
        return state.compareAndSet(PublishJobState.PENDING, PublishJobState.CANCELLED);
    }
}
