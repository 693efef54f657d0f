package uk.gegc.coursemaker.shared.exception;

/**
 * Persistence failure while writing generated results. Retried within the job's retry budget.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
