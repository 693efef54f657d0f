package uk.gegc.coursemaker.shared.exception;

/**
 * Bad input detected synchronously on the request path. Never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
