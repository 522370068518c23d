package github.sarthakdev143.uniq_publisher.exception;

/**
 * The provider refused the post. Retrying the same request will not help.
 */
public class PublishRejectedException extends PublishException {

    public PublishRejectedException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public PublishRejectedException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
