package uk.gegc.coursemaker.features.worker.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.domain.exception.ConcurrencyConflictException;
import uk.gegc.coursemaker.features.job.domain.exception.InvalidJobStateException;
import uk.gegc.coursemaker.features.job.domain.exception.JobCancelledException;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;

import java.util.UUID;

/**
 * Handle given to a running handler for reporting progress and observing cancellation.
 * Created per job run; not shared between threads.
 */
@Slf4j
public class JobExecutionContext {

    private final GenerationJob job;
    private final GenerationJobService jobService;

    public JobExecutionContext(GenerationJob job, GenerationJobService jobService) {
        this.job = job;
        this.jobService = jobService;
    }

    public UUID getJobId() {
        return job.getId();
    }

    public UUID getTenantId() {
        return job.getTenantId();
    }

    /**
     * Enter a checkpoint: stop if the job was cancelled, otherwise record the checkpoint's progress.
     *
     * @throws JobCancelledException if the job was cancelled
     * @throws ConcurrencyConflictException if this worker no longer owns the job
     */
    public void checkpoint(WorkflowCheckpoint checkpoint) {
        throwIfCancelled();
        reportProgress(checkpoint.getPercent(), checkpoint.getMessage());
    }

    public void reportProgress(int percent, String message) {
        try {
            jobService.updateProgress(job.getId(), percent, message);
        } catch (InvalidJobStateException e) {
            if (e.getCurrentStatus() == GenerationJobStatus.CANCELLED) {
                throw new JobCancelledException(job.getId());
            }
            log.warn("Job {} moved to {} while running; abandoning this attempt", job.getId(), e.getCurrentStatus());
            throw new ConcurrencyConflictException(job.getId());
        }
    }

    public void throwIfCancelled() {
        if (jobService.isCancelled(job.getId())) {
            throw new JobCancelledException(job.getId());
        }
    }
}
