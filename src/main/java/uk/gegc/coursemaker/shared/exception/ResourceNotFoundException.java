package uk.gegc.coursemaker.shared.exception;

/**
 * Thrown when a requested job, notification or registration does not exist
 * (or is not visible to the calling tenant).
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
