package github.sarthakdev143.uniq_publisher.exception;

/**
 * The encoder finished but its output is unusable: unreadable, wrong duration or size, or not
 * distinct from the source.
 */
public class OutputValidationFailedException extends EncodeException {

    public OutputValidationFailedException(String message) {
        super(message);
    }

    public OutputValidationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
