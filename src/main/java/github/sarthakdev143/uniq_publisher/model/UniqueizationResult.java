package github.sarthakdev143.uniq_publisher.model;

import java.util.List;

public record UniqueizationResult(List<Variant> variants, List<BatchFailure> failures) {

    public UniqueizationResult {
        variants = variants == null ? List.of() : List.copyOf(variants);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
