package github.sarthakdev143.uniq_publisher.exception;

import github.sarthakdev143.uniq_publisher.model.EncoderBackend;

/**
 * The encoder process exited non-zero, timed out or could not be started.
 */
public class EncodeProcessFailedException extends EncodeException {

    private final EncoderBackend backend;

    public EncodeProcessFailedException(EncoderBackend backend, String message) {
        super(message);
        this.backend = backend;
    }

    public EncodeProcessFailedException(EncoderBackend backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public EncoderBackend backend() {
        return backend;
    }
}
