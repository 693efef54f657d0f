package uk.gegc.coursemaker.features.queue.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the database-backed task queue.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.queue")
public class QueueProperties {

    /**
     * Retry budget for tasks enqueued without an explicit one.
     * Default: 3
     */
    private int defaultMaxRetries = 3;

    /**
     * Number of visible tasks inspected per dequeue attempt.
     */
    private int dequeueBatchSize = 10;

    private Backoff backoff = new Backoff();

    @Data
    public static class Backoff {
        /**
         * Redelivery delay after the first nack (in seconds).
         * Default: 10 seconds
         */
        private long baseSeconds = 10;

        /**
         * Cap on the redelivery delay (in seconds).
         * Default: 900 seconds (15 minutes)
         */
        private long maxSeconds = 900;

        private double jitterFactor = 0.2;
    }
}
