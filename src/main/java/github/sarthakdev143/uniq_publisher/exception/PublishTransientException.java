package github.sarthakdev143.uniq_publisher.exception;

/**
 * Timeout, connection error or a provider status worth retrying (408, 429, 5xx).
 */
public class PublishTransientException extends PublishException {

    public PublishTransientException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public PublishTransientException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
