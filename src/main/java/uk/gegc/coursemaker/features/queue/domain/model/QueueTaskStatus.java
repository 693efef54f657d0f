package uk.gegc.coursemaker.features.queue.domain.model;

public enum QueueTaskStatus {
    PENDING,
    IN_FLIGHT,
    DEAD_LETTER
}
