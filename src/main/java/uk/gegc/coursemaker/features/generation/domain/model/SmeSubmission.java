package uk.gegc.coursemaker.features.generation.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Raw material uploaded by a subject-matter expert for one task, already extracted to text.
 */
@Entity
@Table(name = "sme_submissions", indexes = {
        @Index(name = "idx_sme_submissions_task", columnList = "sme_task_id")
})
@Data
@NoArgsConstructor
public class SmeSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "sme_task_id", nullable = false)
    private UUID smeTaskId;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
