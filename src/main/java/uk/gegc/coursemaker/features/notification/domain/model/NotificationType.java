package uk.gegc.coursemaker.features.notification.domain.model;

public enum NotificationType {
    TASK_ASSIGNED,
    TASK_DUE_SOON,
    INGESTION_COMPLETE,
    INGESTION_FAILED,
    OUTLINE_READY,
    GENERATION_STARTED,
    GENERATION_COMPLETE,
    GENERATION_FAILED,
    APPROVAL_REQUESTED
}
