package uk.gegc.coursemaker.features.job.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for generation job resilience: retry budget, backoff and
 * the stale-job watchdog.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.jobs")
public class JobProperties {

    /**
     * Retry budget given to new jobs.
     * Default: 3
     */
    private int defaultMaxRetries = 3;

    /**
     * PROCESSING jobs older than this are treated as orphaned by a crashed worker.
     * Default: 30 minutes
     */
    private int staleTimeoutMinutes = 30;

    /**
     * Fixed delay between watchdog runs (in seconds).
     * Default: 60 seconds
     */
    private int reclaimFixedDelaySeconds = 60;

    /**
     * Page size used when listing jobs without an explicit size.
     */
    private int defaultPageSize = 20;

    private Backoff backoff = new Backoff();

    @Data
    public static class Backoff {
        /**
         * Delay before the first retry (in seconds). Doubles with every further retry.
         * Default: 30 seconds
         */
        private long baseSeconds = 30;

        /**
         * Cap on the retry delay (in seconds).
         * Default: 600 seconds (10 minutes)
         */
        private long maxSeconds = 600;

        /**
         * Random spread applied to each delay (0.0 = none, 0.2 = ±20%).
         * Default: 0.2
         */
        private double jitterFactor = 0.2;
    }
}
