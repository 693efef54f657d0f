package uk.gegc.coursemaker.features.billing.application;

import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistration;
import uk.gegc.coursemaker.features.billing.domain.model.ProvisionedTenant;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of a sign-up from checkout to provisioned tenant. Every status change is a
 * compare-and-set, so duplicate webhooks and redelivered tasks cannot apply twice.
 */
public interface PendingRegistrationService {

    /**
     * Record a sign-up when its checkout session is created. Expires after the configured TTL if never paid.
     */
    PendingRegistration createPendingRegistration(String checkoutSessionId, String email, String companyName,
                                                  String plan, int seatCount);

    Optional<PendingRegistration> findBySessionId(String checkoutSessionId);

    /**
     * PENDING -> PAID.
     *
     * @return true only for the caller whose update won
     */
    boolean markPaid(String checkoutSessionId, String stripeCustomerId, String stripeSubscriptionId);

    /**
     * PAID -> PROVISIONING.
     *
     * @return the registration when this caller took it over, empty otherwise
     */
    Optional<PendingRegistration> beginProvisioning(String checkoutSessionId);

    /**
     * Create the tenant (once per session) and delete the registration.
     */
    ProvisionedTenant completeProvisioning(PendingRegistration registration);

    /**
     * PROVISIONING -> PAID for another attempt, or -> FAILED when no attempts remain.
     */
    void recordProvisioningFailure(String checkoutSessionId, String error, boolean finalAttempt);

    boolean isProvisioned(String checkoutSessionId);

    List<PendingRegistration> findPaidNotUpdatedFor(Duration age);

    /**
     * @return number of expired PENDING registrations removed
     */
    int deleteExpiredPending();
}
