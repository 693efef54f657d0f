package uk.gegc.coursemaker.shared.exception;

/**
 * External AI call failed in a way that may succeed later (timeout, rate limit, unparseable output).
 */
public class TransientProviderException extends RuntimeException {

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
