package uk.gegc.coursemaker.features.notification.domain.model;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH
}
