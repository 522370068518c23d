package github.sarthakdev143.uniq_publisher.service.impl;

import github.sarthakdev143.uniq_publisher.model.BatchFailure;
import github.sarthakdev143.uniq_publisher.model.BatchResult;
import github.sarthakdev143.uniq_publisher.model.FailureReason;
import github.sarthakdev143.uniq_publisher.model.JobOutcome;
import github.sarthakdev143.uniq_publisher.model.PublishJobState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds pre-dispatch failures and job outcomes into the caller-facing summary. Never throws.
 */
@Component
public class BatchResultAggregator {

    public BatchResult aggregate(
            int totalAccounts,
            int totalVideos,
            List<JobOutcome> outcomes,
            List<BatchFailure> preDispatchFailures) {
        List<BatchFailure> failures = new ArrayList<>();
        if (preDispatchFailures != null) {
            for (BatchFailure failure : preDispatchFailures) {
                if (failure != null) {
                    failures.add(failure);
                }
            }
        }

        int published = 0;
        if (outcomes != null) {
            for (JobOutcome outcome : outcomes) {
                if (outcome == null) {
                    continue;
                }
                if (outcome.state() == PublishJobState.SUCCEEDED) {
                    published++;
                } else {
                    FailureReason reason = outcome.failureReason() != null
                            ? outcome.failureReason()
                            : FailureReason.PUBLISH_REJECTED;
                    failures.add(BatchFailure.of(outcome.target(), reason, outcome.message()));
                }
            }
        }

        return new BatchResult(totalAccounts, totalVideos, published, failures);
    }
}
