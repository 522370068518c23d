package github.sarthakdev143.uniq_publisher.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublishJobTest {

    private static final AccountTarget TARGET = new AccountTarget("42", Platform.VK, AccountType.GROUP);

    @Test
    void successfulLifecycle() {
        PublishJob job = job(" caption ");

        assertThat(job.markInFlight()).isTrue();
        assertThat(job.recordAttempt()).isEqualTo(1);
        assertThat(job.markSucceeded("post-1")).isTrue();

        assertThat(job.state()).isEqualTo(PublishJobState.SUCCEEDED);
        assertThat(job.providerPostId()).isEqualTo("post-1");
        assertThat(job.toRequest().caption()).isEqualTo("caption");
    }

    @Test
    void terminalStatesCannotBeLeft() {
        PublishJob job = job(null);
        job.markInFlight();
        job.markFailed("rejected");

        assertThat(job.markSucceeded("late")).isFalse();
        assertThat(job.cancel()).isFalse();
        assertThat(job.markInFlight()).isFalse();
        assertThat(job.state()).isEqualTo(PublishJobState.FAILED);
        assertThat(job.lastError()).isEqualTo("rejected");
    }

    @Test
    void onlyPendingJobsCanBeCancelled() {
        PublishJob pending = job(null);
        PublishJob inFlight = job(null);
        inFlight.markInFlight();

        assertThat(pending.cancel()).isTrue();
        assertThat(inFlight.cancel()).isFalse();
        assertThat(pending.state().isTerminal()).isTrue();
    }

    @Test
    void attemptsAreOnlyCountedInFlight() {
        PublishJob job = job(null);

        assertThatThrownBy(job::recordAttempt).isInstanceOf(IllegalStateException.class);
        assertThat(job.attempts()).isZero();
    }

    @Test
    void outcomeRequiresTerminalState() {
        assertThatThrownBy(() -> new JobOutcome(TARGET, PublishJobState.IN_FLIGHT, 1, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private PublishJob job(String caption) {
        Variant variant = new Variant(TARGET, Path.of("v.mp4"), null, EncoderBackend.SOFTWARE, 1, "sum");
        return new PublishJob("job-1", variant, "https://cdn.test/v.mp4", caption, Instant.parse("2026-01-01T00:00:00Z"));
    }
}
