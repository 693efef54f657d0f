package uk.gegc.coursemaker.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistration;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Status changes are compare-and-set updates keyed by checkout session; 0 rows means the
 * registration was not in the expected status.
 */
public interface PendingRegistrationRepository extends JpaRepository<PendingRegistration, UUID> {

    Optional<PendingRegistration> findByCheckoutSessionId(String checkoutSessionId);

    boolean existsByCheckoutSessionId(String checkoutSessionId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PendingRegistration r
        SET r.status = :paid,
            r.stripeCustomerId = :customerId,
            r.stripeSubscriptionId = :subscriptionId,
            r.updatedAt = :now
        WHERE r.checkoutSessionId = :sessionId AND r.status = :pending
    """)
    int markPaid(@Param("sessionId") String sessionId,
                 @Param("pending") PendingRegistrationStatus pending,
                 @Param("paid") PendingRegistrationStatus paid,
                 @Param("customerId") String customerId,
                 @Param("subscriptionId") String subscriptionId,
                 @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PendingRegistration r
        SET r.status = :to, r.errorMessage = :error, r.updatedAt = :now
        WHERE r.checkoutSessionId = :sessionId AND r.status = :from
    """)
    int transition(@Param("sessionId") String sessionId,
                   @Param("from") PendingRegistrationStatus from,
                   @Param("to") PendingRegistrationStatus to,
                   @Param("error") String error,
                   @Param("now") LocalDateTime now);

    List<PendingRegistration> findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(PendingRegistrationStatus status,
                                                                               LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM PendingRegistration r WHERE r.status = :pending AND r.expiresAt < :now")
    int deleteExpired(@Param("pending") PendingRegistrationStatus pending, @Param("now") LocalDateTime now);
}
