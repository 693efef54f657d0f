package uk.gegc.coursemaker.shared.exception;

/**
 * External AI call failed for a reason retrying will not fix (invalid credentials, exhausted quota).
 */
public class PermanentProviderException extends RuntimeException {

    public PermanentProviderException(String message) {
        super(message);
    }

    public PermanentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
