package uk.gegc.coursemaker.features.queue.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Durable unit of background work. A task only names its subject (a job id, a checkout
 * session id); the subject's own row holds the state.
 */
@Entity
@Table(name = "queue_tasks", indexes = {
        @Index(name = "idx_queue_tasks_status_available", columnList = "status, available_at"),
        @Index(name = "idx_queue_tasks_type", columnList = "task_type")
})
@Data
@NoArgsConstructor
public class QueueTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_type", nullable = false, length = 64)
    private String taskType;

    @Column(name = "subject_id", nullable = false)
    private String subjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "queue_name", nullable = false, length = 16)
    private QueueName queueName = QueueName.DEFAULT;

    @Column(name = "priority", nullable = false)
    private int priority = QueueName.DEFAULT.getPriority();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private QueueTaskStatus status = QueueTaskStatus.PENDING;

    @Column(name = "deliveries", nullable = false)
    private int deliveries = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = 3;

    @Column(name = "available_at", nullable = false)
    private LocalDateTime availableAt;

    @Column(name = "lease_expires_at")
    private LocalDateTime leaseExpiresAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "dead_lettered_at")
    private LocalDateTime deadLetteredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * True once this delivery is the last one the retry budget allows.
     */
    public boolean isFinalDelivery() {
        return deliveries > maxRetries;
    }
}
