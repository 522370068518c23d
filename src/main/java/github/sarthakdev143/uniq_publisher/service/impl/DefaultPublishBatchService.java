package github.sarthakdev143.uniq_publisher.service.impl;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.BatchValidationException;
import github.sarthakdev143.uniq_publisher.exception.NoEncoderAvailableException;
import github.sarthakdev143.uniq_publisher.integration.video.EncoderCapability;
import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.BatchFailure;
import github.sarthakdev143.uniq_publisher.model.BatchRequest;
import github.sarthakdev143.uniq_publisher.model.BatchResult;
import github.sarthakdev143.uniq_publisher.model.BatchState;
import github.sarthakdev143.uniq_publisher.model.BatchStatus;
import github.sarthakdev143.uniq_publisher.model.CancellationSignal;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.FailureReason;
import github.sarthakdev143.uniq_publisher.model.JobOutcome;
import github.sarthakdev143.uniq_publisher.model.MediaInfo;
import github.sarthakdev143.uniq_publisher.model.PublishJob;
import github.sarthakdev143.uniq_publisher.model.SourceMedia;
import github.sarthakdev143.uniq_publisher.model.StoredMedia;
import github.sarthakdev143.uniq_publisher.model.UniqueizationResult;
import github.sarthakdev143.uniq_publisher.model.Variant;
import github.sarthakdev143.uniq_publisher.service.MediaProbe;
import github.sarthakdev143.uniq_publisher.service.PublishBatchService;
import github.sarthakdev143.uniq_publisher.service.PublishOrchestrator;
import github.sarthakdev143.uniq_publisher.service.UniqueizationEngine;
import github.sarthakdev143.uniq_publisher.storage.VariantStorage;
import github.sarthakdev143.uniq_publisher.util.Checksums;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class DefaultPublishBatchService implements PublishBatchService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPublishBatchService.class);

    private final EncoderCapability encoderCapability;
    private final MediaProbe mediaProbe;
    private final UniqueizationEngine uniqueizationEngine;
    private final VariantStorage variantStorage;
    private final PublishOrchestrator publishOrchestrator;
    private final BatchResultAggregator aggregator;
    private final ScheduledTimeParser scheduledTimeParser;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final int maxCaptionLength;
    private final Duration statusRetention;
    private final MeterRegistry meterRegistry;
    private final Map<String, BatchStatus> batches = new ConcurrentHashMap<>();
    private final Map<String, CancellationSignal> cancellations = new ConcurrentHashMap<>();

    public DefaultPublishBatchService(
            EncoderCapability encoderCapability,
            MediaProbe mediaProbe,
            UniqueizationEngine uniqueizationEngine,
            VariantStorage variantStorage,
            PublishOrchestrator publishOrchestrator,
            BatchResultAggregator aggregator,
            ScheduledTimeParser scheduledTimeParser,
            @Qualifier("batchTaskExecutor") TaskExecutor taskExecutor,
            Clock clock,
            UniqPublisherProperties properties,
            MeterRegistry meterRegistry) {
        this.encoderCapability = encoderCapability;
        this.mediaProbe = mediaProbe;
        this.uniqueizationEngine = uniqueizationEngine;
        this.variantStorage = variantStorage;
        this.publishOrchestrator = publishOrchestrator;
        this.aggregator = aggregator;
        this.scheduledTimeParser = scheduledTimeParser;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.maxCaptionLength = properties.getBatch().getMaxCaptionLength();
        this.statusRetention = properties.getBatch().getStatusRetention();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public BatchResult publish(BatchRequest request) throws IOException, InterruptedException {
        String batchId = UUID.randomUUID().toString();
        try {
            BatchResult result = runBatch(batchId, request, CancellationSignal.none());
            countBatch("completed");
            return result;
        } catch (BatchValidationException e) {
            countBatch("rejected");
            throw e;
        } catch (IOException | InterruptedException | RuntimeException e) {
            countBatch("failed");
            throw e;
        }
    }

    @Override
    public String submitBatch(BatchRequest request) {
        validate(request);

        String batchId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        evictExpiredStatuses(now);
        CancellationSignal cancellation = new CancellationSignal();
        cancellations.put(batchId, cancellation);
        batches.put(batchId, new BatchStatus(
                batchId,
                BatchState.QUEUED,
                "Batch queued.",
                now,
                now,
                request.scheduledAt(),
                request.targets().size(),
                null));

        logger.info(
                "Accepted batch {} accounts={} scheduledAt={} hasCaption={}",
                batchId,
                request.targets().size(),
                scheduledTimeParser.describe(request.scheduledAt()),
                request.caption() != null);

        taskExecutor.execute(() -> processBatch(batchId, request, cancellation));
        return batchId;
    }

    @Override
    public Optional<BatchStatus> getBatchStatus(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    @Override
    public boolean cancelBatch(String batchId) {
        CancellationSignal cancellation = cancellations.get(batchId);
        BatchStatus status = batches.get(batchId);
        if (cancellation == null || status == null || isFinished(status.state())) {
            return false;
        }
        if (cancellation.cancel()) {
            logger.info("Cancellation requested for batch {}", batchId);
            updateBatchState(batchId, status.state(), "Cancellation requested.");
        }
        return true;
    }

    private void processBatch(String batchId, BatchRequest request, CancellationSignal cancellation) {
        try {
            BatchResult result = runBatch(batchId, request, cancellation);
            if (cancellation.isCancelled()) {
                countBatch("cancelled");
                markBatchFinished(batchId, BatchState.CANCELLED, "Batch cancelled. " + summarize(result), result);
            } else {
                countBatch("completed");
                markBatchFinished(batchId, BatchState.COMPLETED, summarize(result), result);
            }
        } catch (BatchValidationException | NoEncoderAvailableException e) {
            countBatch("rejected");
            logger.error("Batch {} aborted: {}", batchId, e.getMessage());
            markBatchFinished(batchId, BatchState.FAILED, e.getMessage(), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            countBatch("failed");
            logger.error("Batch {} interrupted", batchId, e);
            markBatchFinished(batchId, BatchState.FAILED, "Batch interrupted.", null);
        } catch (Exception e) {
            countBatch("failed");
            logger.error("Batch {} failed", batchId, e);
            markBatchFinished(batchId, BatchState.FAILED, "Batch processing failed. Check server logs.", null);
        } finally {
            cancellations.remove(batchId);
        }
    }

    private BatchResult runBatch(String batchId, BatchRequest request, CancellationSignal cancellation)
            throws IOException, InterruptedException {
        validate(request);
        EncoderBackend backend = encoderCapability.backend();
        SourceMedia source = probeSource(request.sourceFile());
        long seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextLong();
        logger.info(
                "Starting batch {} accounts={} backend={} seed={} source={}x{} {}s",
                batchId,
                request.targets().size(),
                backend,
                seed,
                source.width(),
                source.height(),
                source.durationSeconds());

        Path workDir = Files.createTempDirectory("uniq-publisher-" + batchId + "-");
        try {
            updateBatchState(batchId, BatchState.UNIQUEIZING, "Producing account variants.");
            UniqueizationResult uniqueized = uniqueizationEngine.uniqueize(
                    source,
                    request.targets(),
                    seed,
                    backend,
                    workDir,
                    cancellation);

            List<BatchFailure> preDispatchFailures = new ArrayList<>(uniqueized.failures());
            List<PublishJob> jobs = new ArrayList<>();
            for (Variant variant : uniqueized.variants()) {
                try {
                    StoredMedia stored = variantStorage.store(batchId, variant);
                    jobs.add(new PublishJob(
                            batchId + "-" + jobs.size(),
                            variant,
                            stored.url(),
                            request.caption(),
                            request.scheduledAt()));
                } catch (IOException e) {
                    logger.warn("Storing variant failed batch={} account={}", batchId, variant.target().key(), e);
                    preDispatchFailures.add(BatchFailure.of(
                            variant.target(),
                            FailureReason.UNIQUEIZATION_FAILED,
                            "Variant could not be stored: " + e.getMessage()));
                }
            }

            updateBatchState(batchId, BatchState.PUBLISHING, "Scheduling " + jobs.size() + " posts.");
            List<JobOutcome> outcomes = publishOrchestrator.dispatch(batchId, jobs, cancellation);
            BatchResult result = aggregator.aggregate(
                    request.targets().size(),
                    jobs.size(),
                    outcomes,
                    preDispatchFailures);
            logger.info(
                    "Finished batch {} accounts={} videos={} published={} failures={}",
                    batchId,
                    result.totalAccounts(),
                    result.totalVideos(),
                    result.published(),
                    result.failures().size());
            return result;
        } finally {
            deleteRecursively(workDir);
        }
    }

    void validate(BatchRequest request) {
        if (request == null) {
            throw new BatchValidationException("Batch request is required.");
        }
        Path source = request.sourceFile();
        if (source == null) {
            throw new BatchValidationException("sourceFile is required.");
        }
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new BatchValidationException("Source video not found or not readable: " + source);
        }
        if (request.targets().isEmpty()) {
            throw new BatchValidationException("At least one account target is required.");
        }

        Set<String> seen = new HashSet<>();
        for (AccountTarget target : request.targets()) {
            if (target == null) {
                throw new BatchValidationException("Account targets must not contain null entries.");
            }
            if (!seen.add(target.key())) {
                throw new BatchValidationException("Duplicate account target: " + target.key());
            }
        }

        if (request.scheduledAt() == null) {
            throw new BatchValidationException("scheduledAt is required.");
        }
        if (!request.scheduledAt().isAfter(clock.instant())) {
            throw new BatchValidationException(
                    "scheduledAt must be in the future, got " + scheduledTimeParser.describe(request.scheduledAt()) + ".");
        }
        if (request.caption() != null && request.caption().length() > maxCaptionLength) {
            throw new BatchValidationException("caption must be at most " + maxCaptionLength + " characters.");
        }
    }

    private SourceMedia probeSource(Path sourceFile) throws IOException, InterruptedException {
        MediaInfo info;
        try {
            info = mediaProbe.probe(sourceFile);
        } catch (IOException e) {
            throw new BatchValidationException("Source video cannot be decoded: " + e.getMessage());
        }
        return new SourceMedia(
                sourceFile,
                info.format(),
                info.durationSeconds(),
                info.width(),
                info.height(),
                info.audioSampleRate(),
                Files.size(sourceFile),
                Checksums.sha256(sourceFile));
    }

    private void updateBatchState(String batchId, BatchState state, String message) {
        batches.computeIfPresent(batchId, (ignored, current) -> new BatchStatus(
                current.batchId(),
                state,
                message,
                current.createdAt(),
                clock.instant(),
                current.scheduledAt(),
                current.totalAccounts(),
                current.result()));
    }

    private void markBatchFinished(String batchId, BatchState state, String message, BatchResult result) {
        batches.computeIfPresent(batchId, (ignored, current) -> new BatchStatus(
                current.batchId(),
                state,
                message,
                current.createdAt(),
                clock.instant(),
                current.scheduledAt(),
                current.totalAccounts(),
                result));
    }

    /**
     * Drops finished batches whose last update is older than the retention window.
     */
    private void evictExpiredStatuses(Instant now) {
        Instant cutoff = now.minus(statusRetention);
        int before = batches.size();
        batches.values().removeIf(status -> isFinished(status.state()) && status.updatedAt().isBefore(cutoff));
        int evicted = before - batches.size();
        if (evicted > 0) {
            logger.debug("Evicted {} finished batch statuses older than {}", evicted, statusRetention);
        }
    }

    private boolean isFinished(BatchState state) {
        return state == BatchState.COMPLETED || state == BatchState.FAILED || state == BatchState.CANCELLED;
    }

    private String summarize(BatchResult result) {
        return "Published " + result.published() + " of " + result.totalVideos() + " videos for "
                + result.totalAccounts() + " accounts.";
    }

    private void countBatch(String outcome) {
        meterRegistry.counter("uniq_publisher.batches", "outcome", outcome).increment();
    }

    private void deleteRecursively(Path directory) {
        if (directory == null) {
            return;
        }

        try {
            if (Files.notExists(directory)) {
                return;
            }

            try (var pathStream = Files.walk(directory)) {
                pathStream
                        .sorted((left, right) -> right.compareTo(left))
                        .forEach(this::deleteIfExists);
            }
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
