package uk.gegc.coursemaker.features.billing.domain.model;

/**
 * <pre>
 * PENDING -> PAID -> PROVISIONING -> (row deleted once the tenant exists)
 *                         |-> PAID (retry)
 *                         |-> FAILED
 * </pre>
 */
public enum PendingRegistrationStatus {
    PENDING,
    PAID,
    PROVISIONING,
    FAILED
}
