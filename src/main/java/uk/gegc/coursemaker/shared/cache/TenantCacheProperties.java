package uk.gegc.coursemaker.shared.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the tenant-scoped cache and the Caffeine store behind it.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.cache")
public class TenantCacheProperties {

    /**
     * Name of the Spring cache that backs every tenant entry.
     */
    private String cacheName = "tenant-cache";

    /**
     * Maximum number of entries across all tenants.
     * Default: 10,000
     */
    private long maximumSize = 10_000;

    /**
     * TTL used when a caller does not pass one.
     * Default: 5 minutes
     */
    private Duration defaultTtl = Duration.ofMinutes(5);

    /**
     * Hard upper bound enforced by Caffeine regardless of the per-entry TTL.
     * Default: 1 hour
     */
    private Duration maxTtl = Duration.ofHours(1);
}
