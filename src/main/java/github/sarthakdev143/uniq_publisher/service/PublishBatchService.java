package github.sarthakdev143.uniq_publisher.service;

import github.sarthakdev143.uniq_publisher.model.BatchRequest;
import github.sarthakdev143.uniq_publisher.model.BatchResult;
import github.sarthakdev143.uniq_publisher.model.BatchStatus;

import java.io.IOException;
import java.util.Optional;

public interface PublishBatchService {

    /**
     * Runs a batch on the calling thread.
     *
     * @throws github.sarthakdev143.uniq_publisher.exception.BatchValidationException when the request is
     *         rejected before any work starts
     * @throws github.sarthakdev143.uniq_publisher.exception.NoEncoderAvailableException when no encoder
     *         is usable
     */
    BatchResult publish(BatchRequest request) throws IOException, InterruptedException;

    /**
     * Validates the request and queues it for background processing.
     *
     * @return batch id to poll with {@link #getBatchStatus(String)}
     */
    String submitBatch(BatchRequest request);

    Optional<BatchStatus> getBatchStatus(String batchId);

    /**
     * Requests cancellation of a queued or running batch.
     *
     * @return {@code false} when the batch is unknown or already finished
     */
    boolean cancelBatch(String batchId);
}
