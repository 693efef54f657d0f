package uk.gegc.coursemaker.features.generation.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.generation.domain.model.ArtifactKind;
import uk.gegc.coursemaker.features.generation.domain.model.GeneratedArtifact;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface GeneratedArtifactRepository extends JpaRepository<GeneratedArtifact, UUID> {

    Optional<GeneratedArtifact> findFirstByTenantIdAndLessonIdAndKindOrderByCreatedAtDesc(
            UUID tenantId, UUID lessonId, ArtifactKind kind);
}
