package uk.gegc.coursemaker.features.job.domain.exception;

import java.util.UUID;

/**
 * Another worker won the conditional claim on this job. Never reaches an API caller:
 * the losing worker simply moves on.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(UUID jobId) {
        super("Job " + jobId + " was claimed by another worker");
    }
}
