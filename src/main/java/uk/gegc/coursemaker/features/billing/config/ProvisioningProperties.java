package uk.gegc.coursemaker.features.billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for tenant provisioning after checkout.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.provisioning")
public class ProvisioningProperties {

    /**
     * How long an unpaid registration is kept.
     * Default: 24 hours
     */
    private int registrationTtlHours = 24;

    /**
     * Delivery budget of the provisioning task.
     * Default: 10
     */
    private int taskMaxRetries = 10;

    /**
     * PAID registrations untouched for this long get a fresh provisioning task.
     * Default: 5 minutes
     */
    private int reenqueueAfterMinutes = 5;

    /**
     * Default: 15 minutes
     */
    private int warnAfterMinutes = 15;

    /**
     * Default: 30 minutes
     */
    private int errorAfterMinutes = 30;

    /**
     * Fixed delay between reconciliation runs (in seconds).
     * Default: 900 seconds (15 minutes)
     */
    private int reconcileFixedDelaySeconds = 900;
}
