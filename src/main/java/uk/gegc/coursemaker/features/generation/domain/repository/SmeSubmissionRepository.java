package uk.gegc.coursemaker.features.generation.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.generation.domain.model.SmeSubmission;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SmeSubmissionRepository extends JpaRepository<SmeSubmission, UUID> {

    Optional<SmeSubmission> findByIdAndTenantId(UUID id, UUID tenantId);
}
