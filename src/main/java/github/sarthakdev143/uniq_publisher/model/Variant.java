package github.sarthakdev143.uniq_publisher.model;

import java.nio.file.Path;

/**
 * One encoded rendition of the source, produced for exactly one account.
 */
public record Variant(
        AccountTarget target,
        Path file,
        TransformSpec spec,
        EncoderBackend backend,
        long sizeBytes,
        String checksum) {
}
