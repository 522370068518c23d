package github.sarthakdev143.uniq_publisher.service.impl;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.PublishException;
import github.sarthakdev143.uniq_publisher.exception.PublishRejectedException;
import github.sarthakdev143.uniq_publisher.exception.PublishTransientException;
import github.sarthakdev143.uniq_publisher.model.CancellationSignal;
import github.sarthakdev143.uniq_publisher.model.FailureReason;
import github.sarthakdev143.uniq_publisher.model.JobOutcome;
import github.sarthakdev143.uniq_publisher.model.PublishJob;
import github.sarthakdev143.uniq_publisher.model.PublishJobState;
import github.sarthakdev143.uniq_publisher.model.PublishReceipt;
import github.sarthakdev143.uniq_publisher.service.PublishOrchestrator;
import github.sarthakdev143.uniq_publisher.service.PublishingProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;

/**
 * Sends publish jobs with a bounded number in flight.
 *
 * <p>Jobs wait in a ready queue and are started whenever a permit is free. A transient failure releases
 * the permit and puts the same job back on the queue after a backoff delay, so no worker sleeps and a
 * job is never sent twice at the same time.
 */
@Service
public class DefaultPublishOrchestrator implements PublishOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPublishOrchestrator.class);

    private final PublishingProvider publishingProvider;
    private final TaskExecutor taskExecutor;
    private final TaskScheduler retryScheduler;
    private final Clock clock;
    private final UniqPublisherProperties.Publish settings;
    private final Counter succeededCounter;
    private final Counter retriesCounter;
    private final Map<FailureReason, Counter> failedCounters = new EnumMap<>(FailureReason.class);

    public DefaultPublishOrchestrator(
            PublishingProvider publishingProvider,
            @Qualifier("publishTaskExecutor") TaskExecutor taskExecutor,
            @Qualifier("publishRetryScheduler") TaskScheduler retryScheduler,
            Clock clock,
            UniqPublisherProperties properties,
            MeterRegistry meterRegistry) {
        this.publishingProvider = publishingProvider;
        this.taskExecutor = taskExecutor;
        this.retryScheduler = retryScheduler;
        this.clock = clock;
        this.settings = properties.getPublish();
        if (settings.getMaxConcurrency() < 1) {
            throw new IllegalArgumentException("uniq-publisher.publish.max-concurrency must be at least 1.");
        }
        if (settings.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("uniq-publisher.publish.max-attempts must be at least 1.");
        }
        this.succeededCounter = meterRegistry.counter("uniq_publisher.publish.succeeded");
        this.retriesCounter = meterRegistry.counter("uniq_publisher.publish.retries");
        for (FailureReason reason : FailureReason.values()) {
            failedCounters.put(reason, meterRegistry.counter(
                    "uniq_publisher.publish.failed",
                    "reason",
                    reason.name().toLowerCase(Locale.ROOT)));
        }
    }

    @Override
    public List<JobOutcome> dispatch(String batchId, List<PublishJob> jobs, CancellationSignal cancellation) {
        if (jobs.isEmpty()) {
            return List.of();
        }

        Dispatch dispatch = new Dispatch(batchId, jobs, cancellation);
        dispatch.pump();
        return dispatch.awaitOutcomes();
    }

    private final class Dispatch {

        private final String batchId;
        private final List<PublishJob> jobs;
        private final CancellationSignal cancellation;
        private final Deque<PublishJob> ready;
        private final Semaphore permits = new Semaphore(settings.getMaxConcurrency());
        private final Map<PublishJob, JobOutcome> outcomes = new ConcurrentHashMap<>();
        private final CountDownLatch remaining;

        private Dispatch(String batchId, List<PublishJob> jobs, CancellationSignal cancellation) {
            this.batchId = batchId;
            this.jobs = List.copyOf(jobs);
            this.cancellation = cancellation;
            this.ready = new ConcurrentLinkedDeque<>(this.jobs);
            this.remaining = new CountDownLatch(this.jobs.size());
        }

        /**
         * Starts queued jobs while permits are free. Safe to call from any thread; the emptiness check is
         * repeated after a permit is handed back so a job queued concurrently is not stranded.
         */
        void pump() {
            while (!ready.isEmpty()) {
                if (!permits.tryAcquire()) {
                    return;
                }
                PublishJob job = ready.poll();
                if (job == null) {
                    permits.release();
                    continue;
                }
                launch(job);
            }
        }

        private void launch(PublishJob job) {
            try {
                taskExecutor.execute(() -> attempt(job));
            } catch (TaskRejectedException e) {
                logger.error("Publish executor rejected job batch={} account={}", batchId, job.target().key(), e);
                job.markInFlight();
                job.markFailed("Publish executor rejected the job: " + e.getMessage());
                complete(job, JobOutcome.failed(job, FailureReason.PUBLISH_TRANSIENT_EXHAUSTED));
                permits.release();
            }
        }

        private void attempt(PublishJob job) {
            try {
                if (!begin(job)) {
                    return;
                }
                send(job);
            } finally {
                permits.release();
                pump();
            }
        }

        /**
         * Moves the job into flight, or finishes it when the batch was cancelled first.
         */
        private boolean begin(PublishJob job) {
            if (job.state() == PublishJobState.PENDING) {
                if (cancellation.isCancelled() && job.cancel()) {
                    logger.info("Cancelled publish job batch={} account={}", batchId, job.target().key());
                    complete(job, JobOutcome.cancelled(job));
                    return false;
                }
                if (!job.markInFlight()) {
                    throw new IllegalStateException("Job " + job.jobId() + " cannot start from state " + job.state());
                }
                return true;
            }

            if (cancellation.isCancelled()) {
                job.markFailed("Batch cancelled while waiting to retry. Last error: " + job.lastError());
                complete(job, JobOutcome.failed(job, FailureReason.PUBLISH_TRANSIENT_EXHAUSTED));
                return false;
            }
            return true;
        }

        private void send(PublishJob job) {
            int attempt = job.recordAttempt();
            String account = job.target().key();
            try {
                PublishReceipt receipt = publishingProvider.publish(job.toRequest());
                job.markSucceeded(receipt.providerPostId());
                logger.info(
                        "Published batch={} account={} attempt={} postId={}",
                        batchId,
                        account,
                        attempt,
                        receipt.providerPostId());
                complete(job, JobOutcome.succeeded(job));
            } catch (PublishTransientException e) {
                job.recordError(e.getMessage());
                if (attempt >= settings.getMaxAttempts()) {
                    logger.warn(
                            "Publish retries exhausted batch={} account={} attempt={}: {}",
                            batchId,
                            account,
                            attempt,
                            e.getMessage());
                    job.markFailed(e.getMessage());
                    complete(job, JobOutcome.failed(job, FailureReason.PUBLISH_TRANSIENT_EXHAUSTED));
                } else {
                    scheduleRetry(job, attempt, e);
                }
            } catch (PublishRejectedException e) {
                logger.warn("Publish rejected batch={} account={} attempt={}: {}", batchId, account, attempt, e.getMessage());
                job.markFailed(e.getMessage());
                complete(job, JobOutcome.failed(job, FailureReason.PUBLISH_REJECTED));
            } catch (PublishException | RuntimeException e) {
                logger.error("Publish failed unexpectedly batch={} account={} attempt={}", batchId, account, attempt, e);
                job.markFailed(e.getMessage());
                complete(job, JobOutcome.failed(job, FailureReason.PUBLISH_REJECTED));
            }
        }

        private void scheduleRetry(PublishJob job, int attempt, PublishTransientException cause) {
            Duration delay = settings.backoffFor(attempt);
            logger.warn(
                    "Transient publish failure batch={} account={} attempt={}, retrying in {}: {}",
                    batchId,
                    job.target().key(),
                    attempt,
                    delay,
                    cause.getMessage());
            retriesCounter.increment();
            try {
                retryScheduler.schedule(() -> {
                    ready.addFirst(job);
                    pump();
                }, clock.instant().plus(delay));
            } catch (TaskRejectedException e) {
                logger.error("Retry scheduler rejected job batch={} account={}", batchId, job.target().key(), e);
                job.markFailed(cause.getMessage());
                complete(job, JobOutcome.failed(job, FailureReason.PUBLISH_TRANSIENT_EXHAUSTED));
            }
        }

        private void complete(PublishJob job, JobOutcome outcome) {
            if (outcomes.putIfAbsent(job, outcome) != null) {
                return;
            }
            if (outcome.isSucceeded()) {
                succeededCounter.increment();
            } else {
                failedCounters.get(outcome.failureReason()).increment();
            }
            remaining.countDown();
        }

        /**
         * Blocks until every job is terminal. An interrupt cancels the rest of the batch; jobs already in
         * flight are still awaited so their outcome is known.
         */
        List<JobOutcome> awaitOutcomes() {
            boolean interrupted = false;
            while (true) {
                try {
                    remaining.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    if (cancellation.cancel()) {
                        logger.warn("Dispatch of batch={} interrupted, cancelling remaining jobs", batchId);
                    }
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }

            List<JobOutcome> ordered = new ArrayList<>(jobs.size());
            for (PublishJob job : jobs) {
                ordered.add(outcomes.get(job));
            }
            return ordered;
        }
    }
}
