package github.sarthakdev143.uniq_publisher.model;

import java.time.Instant;

public record BatchStatus(
        String batchId,
        BatchState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        Instant scheduledAt,
        int totalAccounts,
        BatchResult result) {
}
