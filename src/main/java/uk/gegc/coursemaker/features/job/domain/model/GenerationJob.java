package uk.gegc.coursemaker.features.job.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Unit of asynchronous generation work.
 *
 * <p>State changes after creation go through conditional bulk updates in
 * {@code GenerationJobRepository}; the entity is never saved back by workers.
 * Children reference their parent by {@link #parentJobId} only and are always found by query.
 */
@Entity
@Table(name = "generation_jobs", indexes = {
        @Index(name = "idx_generation_jobs_status_created", columnList = "status, created_at"),
        @Index(name = "idx_generation_jobs_parent", columnList = "parent_job_id"),
        @Index(name = "idx_generation_jobs_tenant_created", columnList = "tenant_id, created_at")
})
@Data
@NoArgsConstructor
public class GenerationJob {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 32)
    private GenerationJobType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GenerationJobStatus status;

    @Column(name = "course_id")
    private UUID courseId;

    @Column(name = "lesson_id")
    private UUID lessonId;

    @Column(name = "sme_task_id")
    private UUID smeTaskId;

    @Column(name = "submission_id")
    private UUID submissionId;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Column(name = "progress_message")
    private String progressMessage;

    @Column(name = "result_path")
    private String resultPath;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "tokens_used", nullable = false)
    private long tokensUsed;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = DEFAULT_MAX_RETRIES;

    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    @Column(name = "parent_job_id", updatable = false)
    private UUID parentJobId;

    @Column(name = "created_by_user_id", nullable = false, updatable = false)
    private UUID createdByUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = GenerationJobStatus.QUEUED;
        }
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isChild() {
        return parentJobId != null;
    }

    public boolean hasRetryBudget() {
        return retryCount < maxRetries;
    }
}
