package uk.gegc.coursemaker.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.coursemaker.features.billing.domain.model.ProvisionedTenant;

import java.util.Optional;
import java.util.UUID;

public interface ProvisionedTenantRepository extends JpaRepository<ProvisionedTenant, UUID> {

    Optional<ProvisionedTenant> findByCheckoutSessionId(String checkoutSessionId);
}
