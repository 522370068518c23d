package github.sarthakdev143.uniq_publisher.service;

import github.sarthakdev143.uniq_publisher.exception.EncodeException;
import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.EncoderBackend;
import github.sarthakdev143.uniq_publisher.model.SourceMedia;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import github.sarthakdev143.uniq_publisher.model.Variant;

import java.nio.file.Path;

public interface VariantEncoder {

    /**
     * Encodes {@code source} with {@code spec} into {@code output} and checks the result.
     *
     * @throws github.sarthakdev143.uniq_publisher.exception.EncodeProcessFailedException when the
     *         encoder process fails or times out
     * @throws github.sarthakdev143.uniq_publisher.exception.OutputValidationFailedException when the
     *         output is unusable or the spec is outside the configured bounds
     */
    Variant encode(
            SourceMedia source,
            TransformSpec spec,
            AccountTarget target,
            EncoderBackend backend,
            Path output) throws EncodeException, InterruptedException;
}
