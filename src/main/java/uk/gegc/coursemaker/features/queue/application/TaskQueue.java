package uk.gegc.coursemaker.features.queue.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable at-least-once task queue with visibility timeouts and a dead-letter state.
 *
 * <p>A dequeued task stays invisible for the visibility timeout. If it is neither acked nor
 * nacked before the lease runs out it becomes visible again and counts as another delivery.
 */
public interface TaskQueue {

    UUID enqueue(String taskType, String subjectId, EnqueueOptions options);

    /**
     * Lease the next visible task of one of the given types, critical queue first.
     */
    Optional<QueueTask> dequeue(Collection<String> taskTypes, Duration visibilityTimeout, String consumerId);

    /**
     * Remove a finished task. Ignored once the lease has passed to another delivery.
     *
     * @param lease the task exactly as returned by {@link #dequeue}
     */
    void ack(QueueTask lease);

    /**
     * Return a task for redelivery with backoff, or dead-letter it once its deliveries exceed
     * the retry budget. Ignored once the lease has passed to another delivery.
     *
     * @param lease the task exactly as returned by {@link #dequeue}
     */
    void nack(QueueTask lease, String error);

    Page<QueueTask> listDeadLetters(Pageable pageable);

    /**
     * Put a dead-lettered task back in the queue with a fresh delivery budget.
     */
    QueueTask requeueDeadLetter(UUID taskId);
}
