package uk.gegc.coursemaker.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A company sign-up waiting for its Stripe checkout to be paid.
 */
@Entity
@Table(name = "pending_registrations",
        uniqueConstraints = @UniqueConstraint(name = "uk_pending_registrations_session", columnNames = "checkout_session_id"),
        indexes = @Index(name = "idx_pending_registrations_status", columnList = "status"))
@Getter
@Setter
public class PendingRegistration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "checkout_session_id", nullable = false, length = 255, updatable = false)
    private String checkoutSessionId;

    @Column(name = "email", nullable = false, length = 254)
    private String email;

    @Column(name = "company_name", nullable = false, length = 200)
    private String companyName;

    @Column(name = "plan", nullable = false, length = 64)
    private String plan;

    @Column(name = "seat_count", nullable = false)
    private int seatCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PendingRegistrationStatus status = PendingRegistrationStatus.PENDING;

    @Column(name = "stripe_customer_id", length = 255)
    private String stripeCustomerId;

    @Column(name = "stripe_subscription_id", length = 255)
    private String stripeSubscriptionId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;
}
