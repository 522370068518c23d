package github.sarthakdev143.uniq_publisher.exception;

/**
 * No usable video encoder was found by the capability probe. Fatal for the whole batch.
 */
public class NoEncoderAvailableException extends IllegalStateException {

    public NoEncoderAvailableException(String message) {
        super(message);
    }

    public NoEncoderAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
