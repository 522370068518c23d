package github.sarthakdev143.uniq_publisher.model;

import java.util.List;

public record BatchResult(
        int totalAccounts,
        int totalVideos,
        int published,
        List<BatchFailure> failures) {

    public BatchResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
