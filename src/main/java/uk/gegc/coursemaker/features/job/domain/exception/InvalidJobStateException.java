package uk.gegc.coursemaker.features.job.domain.exception;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;

import java.util.UUID;

/**
 * Operation not allowed in the job's current status (e.g. progress on a job that is not PROCESSING).
 */
public class InvalidJobStateException extends RuntimeException {

    private final UUID jobId;
    private final GenerationJobStatus currentStatus;

    public InvalidJobStateException(UUID jobId, GenerationJobStatus currentStatus, String message) {
        super(message);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
    }

    public UUID getJobId() {
        return jobId;
    }

    public GenerationJobStatus getCurrentStatus() {
        return currentStatus;
    }
}
