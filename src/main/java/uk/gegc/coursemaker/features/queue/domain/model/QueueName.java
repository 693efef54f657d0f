package uk.gegc.coursemaker.features.queue.domain.model;

/**
 * Queue families. Lower priority value is dequeued first.
 */
public enum QueueName {

    CRITICAL(0),
    DEFAULT(1),
    LOW(2);

    private final int priority;

    QueueName(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
