package github.sarthakdev143.uniq_publisher.exception;

public class TransformOutOfBoundsException extends OutputValidationFailedException {

    public TransformOutOfBoundsException(String message) {
        super(message);
    }
}
