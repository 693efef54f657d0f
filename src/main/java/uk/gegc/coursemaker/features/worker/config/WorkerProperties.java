package uk.gegc.coursemaker.features.worker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the in-process generation worker pool.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.worker")
public class WorkerProperties {

    /**
     * Start the worker pool with the application context.
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Number of worker loops, each able to run one job at a time.
     * Default: 10
     */
    private int concurrency = 10;

    /**
     * Sleep between polls when neither the queue nor the job table has work (in milliseconds).
     * Default: 1000
     */
    private long pollIntervalMs = 1000;

    /**
     * How long a dequeued task stays invisible to other consumers (in seconds).
     * Default: 900 (15 minutes)
     */
    private long visibilityTimeoutSeconds = 900;

    /**
     * How long shutdown waits for in-flight handlers (in seconds).
     * Default: 30
     */
    private long shutdownDeadlineSeconds = 30;

    /**
     * Prefix of the lease holder id written to claimed tasks. Defaults to a random id per process.
     */
    private String consumerId;
}
