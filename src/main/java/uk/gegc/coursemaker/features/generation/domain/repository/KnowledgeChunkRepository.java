package uk.gegc.coursemaker.features.generation.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.generation.domain.model.KnowledgeChunk;

import java.util.List;
import java.util.UUID;

@Repository
public interface KnowledgeChunkRepository extends JpaRepository<KnowledgeChunk, UUID> {

    /**
     * Highest-relevance chunks of a tenant.
     */
    List<KnowledgeChunk> findByTenantIdOrderByRelevanceScoreDescPositionAsc(UUID tenantId, Pageable pageable);

    List<KnowledgeChunk> findBySubmissionIdOrderByPositionAsc(UUID submissionId);

    @Modifying
    @Query("DELETE FROM KnowledgeChunk c WHERE c.tenantId = :tenantId AND c.submissionId = :submissionId")
    int deleteBySubmission(@Param("tenantId") UUID tenantId, @Param("submissionId") UUID submissionId);
}
