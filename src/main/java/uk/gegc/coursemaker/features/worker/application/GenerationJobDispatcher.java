package uk.gegc.coursemaker.features.worker.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.queue.application.EnqueueOptions;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;
import uk.gegc.coursemaker.features.queue.domain.model.QueueName;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Puts generation jobs on the task queue. A task carries only the job id; the job type is
 * encoded in the task type.
 *
 * <p>Enqueue failures are logged and reported as {@code false}, never thrown: the job row is
 * already committed as QUEUED and the workers' polling fallback will find it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationJobDispatcher {

    static final int GENERATION_TASK_MAX_RETRIES = 3;

    private final TaskQueue taskQueue;
    private final Clock clock;

    public boolean dispatch(GenerationJob job) {
        return dispatchAt(job, null);
    }

    /**
     * Enqueue a task that becomes visible at {@code availableAt}, or immediately when null.
     */
    public boolean dispatchAt(GenerationJob job, LocalDateTime availableAt) {
        Duration delay = Duration.ZERO;
        if (availableAt != null) {
            Duration untilDue = Duration.between(LocalDateTime.now(clock), availableAt);
            delay = untilDue.isNegative() ? Duration.ZERO : untilDue;
        }
        try {
            taskQueue.enqueue(job.getType().taskType(), job.getId().toString(),
                    EnqueueOptions.on(QueueName.DEFAULT, GENERATION_TASK_MAX_RETRIES).withDelay(delay));
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to enqueue {} job {}; leaving it to the polling fallback", job.getType(), job.getId(), e);
            return false;
        }
    }
}
