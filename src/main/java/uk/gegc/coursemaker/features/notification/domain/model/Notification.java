package uk.gegc.coursemaker.features.notification.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * In-app message for one user of one tenant. Only the read flag changes after creation.
 */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notifications_owner_created", columnList = "tenant_id, user_id, created_at"),
        @Index(name = "idx_notifications_job", columnList = "job_id")
})
@Getter
@Setter
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32, updatable = false)
    private NotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16, updatable = false)
    private NotificationPriority priority = NotificationPriority.NORMAL;

    @Column(name = "title", nullable = false, length = 500, updatable = false)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(name = "action_url", length = 500, updatable = false)
    private String actionUrl;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(name = "course_id", updatable = false)
    private UUID courseId;

    @Column(name = "task_id", updatable = false)
    private UUID taskId;

    @Column(name = "sme_id", updatable = false)
    private UUID smeId;

    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    @Column(name = "email_sent", nullable = false)
    private boolean emailSent = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "read_at")
    private LocalDateTime readAt;
}
