package github.sarthakdev143.uniq_publisher.service;

import github.sarthakdev143.uniq_publisher.model.CancellationSignal;
import github.sarthakdev143.uniq_publisher.model.JobOutcome;
import github.sarthakdev143.uniq_publisher.model.PublishJob;

import java.util.List;

public interface PublishOrchestrator {

    /**
     * Sends every job and returns once all of them are terminal. Outcomes are in the order of
     * {@code jobs}.
     */
    List<JobOutcome> dispatch(String batchId, List<PublishJob> jobs, CancellationSignal cancellation);
}
