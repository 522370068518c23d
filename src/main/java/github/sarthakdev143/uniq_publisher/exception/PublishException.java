package github.sarthakdev143.uniq_publisher.exception;

import java.io.IOException;

public abstract class PublishException extends IOException {

    private final Integer statusCode;

    protected PublishException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    protected PublishException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or {@code null} when no response was received.
     */
    public Integer statusCode() {
        return statusCode;
    }
}
