package github.sarthakdev143.uniq_publisher.service.impl;

import github.sarthakdev143.uniq_publisher.exception.EncodeException;
import github.sarthakdev143.uniq_publisher.exception.EncodeProcessFailedException;
import github.sarthakdev143.uniq_publisher.exception.OutputValidationFailedException;
import github.sarthakdev143.uniq_publisher.integration.video.EncoderCapability;
import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.BatchFailure;
import github.sarthakdev143.uniq_publisher.model.CancellationSignal;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.FailureReason;
import github.sarthakdev143.uniq_publisher.model.SourceMedia;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import github.sarthakdev143.uniq_publisher.model.UniqueizationResult;
import github.sarthakdev143.uniq_publisher.model.Variant;
import github.sarthakdev143.uniq_publisher.service.UniqueizationEngine;
import github.sarthakdev143.uniq_publisher.service.VariantEncoder;
import github.sarthakdev143.uniq_publisher.transform.TransformSelector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Encodes one variant per account, one account at a time.
 *
 * <p>Each account gets at most one software retry after a hardware encoder failure and at most one
 * redraw after unusable output. A variant whose checksum matches another account's variant counts as
 * unusable output.
 */
@Service
public class DefaultUniqueizationEngine implements UniqueizationEngine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultUniqueizationEngine.class);

    private final TransformSelector transformSelector;
    private final VariantEncoder variantEncoder;
    private final EncoderCapability encoderCapability;
    private final Counter variantsProducedCounter;
    private final Counter variantsFailedCounter;

    public DefaultUniqueizationEngine(
            TransformSelector transformSelector,
            VariantEncoder variantEncoder,
            EncoderCapability encoderCapability,
            MeterRegistry meterRegistry) {
        this.transformSelector = transformSelector;
        this.variantEncoder = variantEncoder;
        this.encoderCapability = encoderCapability;
        this.variantsProducedCounter = meterRegistry.counter("uniq_publisher.variants.produced");
        this.variantsFailedCounter = meterRegistry.counter("uniq_publisher.variants.failed");
    }

    @Override
    public UniqueizationResult uniqueize(
            SourceMedia source,
            List<AccountTarget> targets,
            long seed,
            EncoderBackend backend,
            Path workDir,
            CancellationSignal cancellation) throws InterruptedException {
        List<Variant> variants = new ArrayList<>();
        List<BatchFailure> failures = new ArrayList<>();
        Set<String> checksums = new HashSet<>();
        checksums.add(source.checksum());

        for (int index = 0; index < targets.size(); index++) {
            AccountTarget target = targets.get(index);
            if (cancellation.isCancelled()) {
                failures.add(BatchFailure.of(
                        target,
                        FailureReason.CANCELLED,
                        "Batch cancelled before the account was uniqueized."));
                continue;
            }

            TransformSpec spec = transformSelector.select(seed, target);
            Path output = workDir.resolve(outputFileName(index, target));
            try {
                Variant variant = encodeWithRetry(source, spec, target, backend, output, checksums);
                variants.add(variant);
                variantsProducedCounter.increment();
            } catch (EncodeException e) {
                variantsFailedCounter.increment();
                failures.add(BatchFailure.of(target, FailureReason.UNIQUEIZATION_FAILED, e.getMessage()));
                logger.warn("Uniqueization failed for account={}: {}", target.key(), e.getMessage());
            }
        }

        logger.info(
                "Uniqueized {} of {} accounts backend={} seed={}",
                variants.size(),
                targets.size(),
                backend,
                seed);
        return new UniqueizationResult(variants, failures);
    }

    private Variant encodeWithRetry(
            SourceMedia source,
            TransformSpec initialSpec,
            AccountTarget target,
            EncoderBackend initialBackend,
            Path output,
            Set<String> checksums) throws EncodeException, InterruptedException {
        TransformSpec spec = initialSpec;
        EncoderBackend backend = initialBackend;
        boolean fellBackToSoftware = false;
        boolean redrawn = false;

        while (true) {
            try {
                Variant variant = variantEncoder.encode(source, spec, target, backend, output);
                if (!checksums.add(variant.checksum())) {
                    deleteIfExists(variant.file());
                    throw new OutputValidationFailedException(
                            "Variant for " + target.key() + " is not distinct from another variant or the source.");
                }
                return variant;
            } catch (EncodeProcessFailedException e) {
                if (fellBackToSoftware || !backend.isHardwareAccelerated()
                        || !encoderCapability.softwareFallbackAvailable()) {
                    throw e;
                }
                fellBackToSoftware = true;
                logger.warn(
                        "Encode on {} failed for account={}, retrying on {}: {}",
                        backend,
                        target.key(),
                        EncoderBackend.SOFTWARE,
                        e.getMessage());
                backend = EncoderBackend.SOFTWARE;
            } catch (OutputValidationFailedException e) {
                if (redrawn) {
                    throw e;
                }
                redrawn = true;
                logger.warn("Output rejected for account={}, redrawing transform: {}", target.key(), e.getMessage());
                spec = transformSelector.redraw(spec);
            }
        }
    }

    private String outputFileName(int index, AccountTarget target) {
        return index + "_" + target.platform().code() + "_"
                + target.accountId().replaceAll("[^A-Za-z0-9._-]", "_") + ".mp4";
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
