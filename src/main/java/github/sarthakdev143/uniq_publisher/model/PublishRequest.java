package github.sarthakdev143.uniq_publisher.model;

import java.time.Instant;

/**
 * What the publishing provider receives for one account.
 */
public record PublishRequest(
        AccountTarget target,
        String mediaUrl,
        String caption,
        Instant scheduledAt) {
}
