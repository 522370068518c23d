package github.sarthakdev143.uniq_publisher.exception;

/**
 * Batch input was rejected before any encode or publish started.
 */
public class BatchValidationException extends IllegalArgumentException {

    public BatchValidationException(String message) {
        super(message);
    }
}
