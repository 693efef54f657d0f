package uk.gegc.coursemaker.features.worker.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.domain.exception.ConcurrencyConflictException;
import uk.gegc.coursemaker.features.job.domain.exception.InvalidJobStateException;
import uk.gegc.coursemaker.features.job.domain.exception.JobCancelledException;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.notification.application.JobMilestoneNotifier;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;

import java.util.Optional;
import java.util.UUID;

/**
 * Runs one delivered task to its outcome. Used by every worker loop; holds no state of its own.
 *
 * <p>Generation tasks are always acked once the job row records the outcome, including a
 * retry: the retry travels as a new delayed task. Other tasks are nacked on failure so the
 * queue's own redelivery applies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationTaskProcessor {

    private final TaskQueue taskQueue;
    private final GenerationJobService jobService;
    private final JobHandlerRegistry handlerRegistry;
    private final JobFailureClassifier failureClassifier;
    private final GenerationJobDispatcher dispatcher;
    private final JobMilestoneNotifier milestoneNotifier;

    public void process(QueueTask task) {
        if (GenerationJobType.isGenerationTaskType(task.getTaskType())) {
            processGenerationTask(task);
        } else {
            processQueueTask(task);
        }
    }

    /**
     * Claim and run one runnable job straight from the job table.
     *
     * @return true if a job was run
     */
    public boolean pollJobTable() {
        Optional<GenerationJob> claimed = jobService.claimNext(handlerRegistry.capabilities());
        if (claimed.isEmpty()) {
            return false;
        }
        log.info("Picked up job {} ({}) from the job table without a queue task",
                claimed.get().getId(), claimed.get().getType());
        run(claimed.get());
        return true;
    }

    /**
     * Execute a job this worker has already claimed and record the outcome.
     */
    public void run(GenerationJob job) {
        MDC.put("jobId", job.getId().toString());
        MDC.put("tenantId", job.getTenantId().toString());
        try {
            execute(job);
        } finally {
            MDC.remove("jobId");
            MDC.remove("tenantId");
        }
    }

    private void processGenerationTask(QueueTask task) {
        UUID jobId;
        try {
            jobId = UUID.fromString(task.getSubjectId());
        } catch (IllegalArgumentException e) {
            log.error("Task {} carries malformed job id '{}'; dropping it", task.getId(), task.getSubjectId());
            taskQueue.ack(task);
            return;
        }

        try {
            Optional<GenerationJob> claimed = jobService.claim(jobId);
            if (claimed.isEmpty()) {
                log.debug("Job {} is not claimable (claimed elsewhere, waiting, or finished); acking task {}",
                        jobId, task.getId());
            } else {
                run(claimed.get());
            }
            taskQueue.ack(task);
        } catch (RuntimeException e) {
            log.error("Could not record outcome of job {} from task {}; releasing task", jobId, task.getId(), e);
            taskQueue.nack(task, e.getMessage());
        }
    }

    private void processQueueTask(QueueTask task) {
        Optional<QueueTaskHandler> handler = handlerRegistry.taskHandlerFor(task.getTaskType());
        if (handler.isEmpty()) {
            log.error("No handler registered for task type {} (task {})", task.getTaskType(), task.getId());
            taskQueue.nack(task, "No handler registered for task type " + task.getTaskType());
            return;
        }
        try {
            handler.get().handle(task);
            taskQueue.ack(task);
        } catch (RuntimeException e) {
            log.error("Task {} ({}) failed on delivery {}", task.getId(), task.getTaskType(), task.getDeliveries(), e);
            taskQueue.nack(task, e.getMessage());
        }
    }

    private void execute(GenerationJob job) {
        Optional<GenerationJobHandler> handler = handlerRegistry.handlerFor(job.getType());
        if (handler.isEmpty()) {
            GenerationJob failed = jobService.fail(job.getId(), "No handler registered for job type " + job.getType(), false);
            notifyIfFailed(failed);
            return;
        }

        if (job.getRetryCount() == 0) {
            milestoneNotifier.jobStarted(job);
        }

        try {
            JobResult result = handler.get().execute(job, new JobExecutionContext(job, jobService));
            GenerationJob completed = jobService.complete(job.getId(), result.resultPath(), result.tokensUsed());
            if (completed.getStatus() == GenerationJobStatus.COMPLETED) {
                milestoneNotifier.jobCompleted(completed);
            }
        } catch (JobCancelledException e) {
            log.info("Job {} stopped at checkpoint after cancellation", job.getId());
        } catch (ConcurrencyConflictException | InvalidJobStateException e) {
            log.warn("Job {} is no longer owned by this worker; discarding attempt: {}", job.getId(), e.getMessage());
        } catch (RuntimeException e) {
            JobFailureClassifier.FailureDecision decision = failureClassifier.classify(e);
            log.error("Job {} ({}) failed, retryable={}", job.getId(), job.getType(), decision.retryable(), e);
            GenerationJob after = jobService.fail(job.getId(), decision.message(), decision.retryable());
            if (after.getStatus() == GenerationJobStatus.QUEUED) {
                dispatcher.dispatchAt(after, after.getNextAttemptAt());
            } else {
                notifyIfFailed(after);
            }
        }
    }

    private void notifyIfFailed(GenerationJob job) {
        if (job.getStatus() == GenerationJobStatus.FAILED) {
            milestoneNotifier.jobFailed(job);
        }
    }
}
