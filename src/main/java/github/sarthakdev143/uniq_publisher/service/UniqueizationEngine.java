package github.sarthakdev143.uniq_publisher.service;

import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.CancellationSignal;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.SourceMedia;
import github.sarthakdev143.uniq_publisher.model.UniqueizationResult;

import java.nio.file.Path;
import java.util.List;

public interface UniqueizationEngine {

    /**
     * Produces one variant per target. Per-target failures are returned in the result; only a missing
     * encoder aborts the call.
     *
     * @param workDir directory the variant files are written to
     * @throws github.sarthakdev143.uniq_publisher.exception.NoEncoderAvailableException when no encoder
     *         can be used at all
     */
    UniqueizationResult uniqueize(
            SourceMedia source,
            List<AccountTarget> targets,
            long seed,
            EncoderBackend backend,
            Path workDir,
            CancellationSignal cancellation) throws InterruptedException;
}
