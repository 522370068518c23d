package github.sarthakdev143.uniq_publisher.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * One batch: a source video, the accounts to post it to, a shared schedule and an optional shared
 * caption. {@code seed} may be {@code null}; a random one is drawn and logged in that case.
 */
public record BatchRequest(
        Path sourceFile,
        List<AccountTarget> targets,
        Instant scheduledAt,
        String caption,
        Long seed) {

    public BatchRequest {
        targets = targets == null ? List.of() : List.copyOf(targets);
        caption = caption == null || caption.isBlank() ? null : caption;
    }

    public BatchRequest(Path sourceFile, List<AccountTarget> targets, Instant scheduledAt, String caption) {
        this(sourceFile, targets, scheduledAt, caption, null);
    }
}
