package uk.gegc.coursemaker.features.generation.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "knowledge_chunks", indexes = {
        @Index(name = "idx_knowledge_chunks_tenant_score", columnList = "tenant_id, relevance_score"),
        @Index(name = "idx_knowledge_chunks_submission", columnList = "submission_id")
})
@Data
@NoArgsConstructor
public class KnowledgeChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "sme_task_id", nullable = false)
    private UUID smeTaskId;

    @Column(name = "submission_id", nullable = false)
    private UUID submissionId;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    /**
     * Model-assigned relevance in [0, 1].
     */
    @Column(name = "relevance_score", nullable = false)
    private double relevanceScore;
}
