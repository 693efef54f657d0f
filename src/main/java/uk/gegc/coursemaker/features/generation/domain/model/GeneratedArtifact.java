package uk.gegc.coursemaker.features.generation.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Stored output of a generation job. Regenerating writes a new artifact; the newest one of a
 * kind wins.
 */
@Entity
@Table(name = "generated_artifacts", indexes = {
        @Index(name = "idx_generated_artifacts_lesson", columnList = "tenant_id, lesson_id, kind, created_at")
})
@Data
@NoArgsConstructor
public class GeneratedArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "course_id")
    private UUID courseId;

    @Column(name = "lesson_id")
    private UUID lessonId;

    @Column(name = "component_id")
    private UUID componentId;

    @Column(name = "sme_task_id")
    private UUID smeTaskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private ArtifactKind kind;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Location reported as the job's result.
     */
    public String resultPath() {
        return "tenants/" + tenantId + "/artifacts/" + id;
    }
}
