package uk.gegc.coursemaker.features.queue.application;

import uk.gegc.coursemaker.features.queue.domain.model.QueueName;

import java.time.Duration;

/**
 * Per-task enqueue settings. A null {@code maxRetries} means the queue default.
 */
public record EnqueueOptions(Duration delay, Integer maxRetries, QueueName queue) {

    public static EnqueueOptions defaults() {
        return new EnqueueOptions(Duration.ZERO, null, QueueName.DEFAULT);
    }

    public static EnqueueOptions on(QueueName queue, int maxRetries) {
        return new EnqueueOptions(Duration.ZERO, maxRetries, queue);
    }

    public EnqueueOptions withDelay(Duration delay) {
        return new EnqueueOptions(delay, maxRetries, queue);
    }
}
