package uk.gegc.coursemaker.features.worker.application;

import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

/**
 * Executes one kind of generation job. Exactly one handler may exist per job type.
 *
 * <p>Implementations must be idempotent: a job can be delivered again after a worker crash
 * or a lease timeout.
 */
public interface GenerationJobHandler {

    GenerationJobType handlesType();

    /**
     * Run the job to completion. Progress and cancellation go through {@code context};
     * failures are thrown and classified by the worker.
     */
    JobResult execute(GenerationJob job, JobExecutionContext context);
}
