package uk.gegc.coursemaker.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "provisioned_tenants",
        uniqueConstraints = @UniqueConstraint(name = "uk_provisioned_tenants_session", columnNames = "checkout_session_id"))
@Getter
@Setter
public class ProvisionedTenant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "checkout_session_id", nullable = false, length = 255, updatable = false)
    private String checkoutSessionId;

    @Column(name = "company_name", nullable = false, length = 200)
    private String companyName;

    @Column(name = "owner_email", nullable = false, length = 254)
    private String ownerEmail;

    @Column(name = "plan", nullable = false, length = 64)
    private String plan;

    @Column(name = "seat_count", nullable = false)
    private int seatCount;

    @Column(name = "stripe_customer_id", length = 255)
    private String stripeCustomerId;

    @Column(name = "stripe_subscription_id", length = 255)
    private String stripeSubscriptionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
