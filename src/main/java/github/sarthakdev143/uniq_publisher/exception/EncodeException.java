package github.sarthakdev143.uniq_publisher.exception;

import java.io.IOException;

public abstract class EncodeException extends IOException {

    protected EncodeException(String message) {
        super(message);
    }

    protected EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
