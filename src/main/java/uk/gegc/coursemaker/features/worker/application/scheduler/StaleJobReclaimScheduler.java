package uk.gegc.coursemaker.features.worker.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.config.JobProperties;
import uk.gegc.coursemaker.features.worker.application.GenerationJobDispatcher;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Watchdog for jobs left PROCESSING by a worker that died or lost its lease.
 * Reclaimed jobs go back to QUEUED and get a fresh queue task.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleJobReclaimScheduler {

    private final GenerationJobService jobService;
    private final GenerationJobDispatcher dispatcher;
    private final JobProperties jobProperties;

    /**
     * The delay is configurable via coursemaker.jobs.reclaim-fixed-delay-seconds.
     * Default: 60 seconds
     */
    @Scheduled(fixedDelayString = "${coursemaker.jobs.reclaim-fixed-delay-seconds:60}000")
    public void reclaimStaleJobs() {
        log.debug("Running scheduled reclaim of stale generation jobs");
        try {
            List<UUID> reclaimed = jobService.reclaimStale(Duration.ofMinutes(jobProperties.getStaleTimeoutMinutes()));
            for (UUID jobId : reclaimed) {
                jobService.findJob(jobId).ifPresent(dispatcher::dispatch);
            }
            if (!reclaimed.isEmpty()) {
                log.info("Reclaimed {} stale job(s): {}", reclaimed.size(), reclaimed);
            }
        } catch (Exception e) {
            log.error("Error during scheduled reclaim of stale jobs", e);
        }
    }
}
