package uk.gegc.coursemaker.features.job.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Micrometer counters and timers for the generation job lifecycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationJobMetrics {

    private final MeterRegistry meterRegistry;

    public void jobCreated(GenerationJobType type) {
        counter("generation.jobs.created", "type", type.name()).increment();
    }

    public void jobCompleted(GenerationJob job, LocalDateTime completedAt) {
        counter("generation.jobs.completed", "type", job.getType().name()).increment();
        if (job.getStartedAt() != null) {
            Timer.builder("generation.jobs.duration")
                    .description("Wall time from claim to completion")
                    .tag("type", job.getType().name())
                    .register(meterRegistry)
                    .record(Duration.between(job.getStartedAt(), completedAt));
        }
    }

    public void jobFailed(GenerationJobType type, boolean willRetry) {
        Counter.builder("generation.jobs.failed")
                .description("Failed job attempts")
                .tag("type", type.name())
                .tag("retryable", String.valueOf(willRetry))
                .register(meterRegistry)
                .increment();
    }

    public void jobsReclaimed(int count) {
        if (count > 0) {
            log.info("METRIC: generation.jobs.reclaimed count={}", count);
            counter("generation.jobs.reclaimed").increment(count);
        }
    }

    private Counter counter(String name, String... tags) {
        return Counter.builder(name).tags(tags).register(meterRegistry);
    }
}
