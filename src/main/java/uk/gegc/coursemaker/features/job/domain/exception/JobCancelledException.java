package uk.gegc.coursemaker.features.job.domain.exception;

import java.util.UUID;

/**
 * Raised at a workflow checkpoint once the running job has been cancelled. The worker stops
 * the handler and leaves the job CANCELLED.
 */
public class JobCancelledException extends RuntimeException {

    private final UUID jobId;

    public JobCancelledException(UUID jobId) {
        super("Job " + jobId + " was cancelled");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
