package uk.gegc.coursemaker.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.coursemaker.features.billing.application.PendingRegistrationService;
import uk.gegc.coursemaker.features.billing.config.ProvisioningProperties;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistration;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus;
import uk.gegc.coursemaker.features.billing.domain.model.ProvisionedTenant;
import uk.gegc.coursemaker.features.billing.infra.repository.PendingRegistrationRepository;
import uk.gegc.coursemaker.features.billing.infra.repository.ProvisionedTenantRepository;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus.FAILED;
import static uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus.PAID;
import static uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus.PENDING;
import static uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus.PROVISIONING;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class PendingRegistrationServiceImpl implements PendingRegistrationService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final PendingRegistrationRepository registrationRepository;
    private final ProvisionedTenantRepository tenantRepository;
    private final ProvisioningProperties properties;
    private final Clock clock;

    @Override
    public PendingRegistration createPendingRegistration(String checkoutSessionId, String email, String companyName,
                                                         String plan, int seatCount) {
        if (!StringUtils.hasText(checkoutSessionId)) {
            throw new ValidationException("Checkout session id is required");
        }
        if (!StringUtils.hasText(email) || !StringUtils.hasText(companyName) || !StringUtils.hasText(plan)) {
            throw new ValidationException("Email, company name and plan are required");
        }
        if (seatCount < 1) {
            throw new ValidationException("Seat count must be at least 1");
        }
        if (registrationRepository.existsByCheckoutSessionId(checkoutSessionId)) {
            throw new ValidationException("A registration already exists for checkout session " + checkoutSessionId);
        }

        LocalDateTime now = now();
        PendingRegistration registration = new PendingRegistration();
        registration.setCheckoutSessionId(checkoutSessionId);
        registration.setEmail(email);
        registration.setCompanyName(companyName);
        registration.setPlan(plan);
        registration.setSeatCount(seatCount);
        registration.setStatus(PENDING);
        registration.setCreatedAt(now);
        registration.setUpdatedAt(now);
        registration.setExpiresAt(now.plusHours(properties.getRegistrationTtlHours()));

        PendingRegistration saved = registrationRepository.save(registration);
        log.info("Created pending registration {} for checkout session {}", saved.getId(), checkoutSessionId);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PendingRegistration> findBySessionId(String checkoutSessionId) {
        return registrationRepository.findByCheckoutSessionId(checkoutSessionId);
    }

    @Override
    public boolean markPaid(String checkoutSessionId, String stripeCustomerId, String stripeSubscriptionId) {
        int updated = registrationRepository.markPaid(checkoutSessionId, PENDING, PAID,
                stripeCustomerId, stripeSubscriptionId, now());
        return updated == 1;
    }

    @Override
    public Optional<PendingRegistration> beginProvisioning(String checkoutSessionId) {
        int updated = registrationRepository.transition(checkoutSessionId, PAID, PROVISIONING, null, now());
        if (updated == 0) {
            return Optional.empty();
        }
        return registrationRepository.findByCheckoutSessionId(checkoutSessionId);
    }

    @Override
    public ProvisionedTenant completeProvisioning(PendingRegistration registration) {
        String sessionId = registration.getCheckoutSessionId();
        ProvisionedTenant tenant = tenantRepository.findByCheckoutSessionId(sessionId)
                .orElseGet(() -> tenantRepository.save(newTenant(registration)));
        registrationRepository.findByCheckoutSessionId(sessionId)
                .ifPresent(registrationRepository::delete);
        log.info("Provisioned tenant {} for company '{}' (session {})", tenant.getId(), tenant.getCompanyName(), sessionId);
        return tenant;
    }

    @Override
    public void recordProvisioningFailure(String checkoutSessionId, String error, boolean finalAttempt) {
        PendingRegistrationStatus target = finalAttempt ? FAILED : PAID;
        int updated = registrationRepository.transition(checkoutSessionId, PROVISIONING, target, truncate(error), now());
        if (updated == 0) {
            log.warn("Registration for session {} was not PROVISIONING when recording failure", checkoutSessionId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isProvisioned(String checkoutSessionId) {
        return tenantRepository.findByCheckoutSessionId(checkoutSessionId).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PendingRegistration> findPaidNotUpdatedFor(Duration age) {
        return registrationRepository.findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(PAID, now().minus(age));
    }

    @Override
    public int deleteExpiredPending() {
        return registrationRepository.deleteExpired(PENDING, now());
    }

    private ProvisionedTenant newTenant(PendingRegistration registration) {
        ProvisionedTenant tenant = new ProvisionedTenant();
        tenant.setCheckoutSessionId(registration.getCheckoutSessionId());
        tenant.setCompanyName(registration.getCompanyName());
        tenant.setOwnerEmail(registration.getEmail());
        tenant.setPlan(registration.getPlan());
        tenant.setSeatCount(registration.getSeatCount());
        tenant.setStripeCustomerId(registration.getStripeCustomerId());
        tenant.setStripeSubscriptionId(registration.getStripeSubscriptionId());
        tenant.setCreatedAt(now());
        return tenant;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
