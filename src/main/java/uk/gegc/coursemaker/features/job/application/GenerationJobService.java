package uk.gegc.coursemaker.features.job.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.FullCoursePayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Job store: persistence and atomic state transitions for generation jobs.
 */
public interface GenerationJobService {

    /**
     * Create a QUEUED job with progress 0 after validating the payload against its type.
     */
    GenerationJob createJob(UUID tenantId, UUID userId, GenerationJobPayload payload);

    /**
     * Create a batch parent directly in PROCESSING. It never enters the queue.
     */
    GenerationJob createBatchParent(UUID tenantId, UUID userId, FullCoursePayload payload, String progressMessage);

    /**
     * Create a QUEUED child under the given parent, inheriting tenant and creator.
     */
    GenerationJob createChildJob(GenerationJob parent, GenerationJobPayload payload);

    /**
     * Claim the oldest runnable QUEUED job of one of the given types.
     */
    Optional<GenerationJob> claimNext(Set<GenerationJobType> capabilities);

    /**
     * Claim a specific job. Empty when it is not QUEUED or another worker got there first.
     */
    Optional<GenerationJob> claim(UUID jobId);

    /**
     * Update progress of a PROCESSING job.
     */
    void updateProgress(UUID jobId, int percent, String message);

    /**
     * Mark a PROCESSING job as completed. Repeated calls on a terminal job are no-ops.
     */
    GenerationJob complete(UUID jobId, String resultPath, long tokensUsed);

    /**
     * Record a failed attempt. Requeues with backoff while budget remains and the error is
     * retryable, otherwise fails the job for good.
     */
    GenerationJob fail(UUID jobId, String errorMessage, boolean retryable);

    /**
     * Cancel a QUEUED or PROCESSING job (and the active children of a batch parent).
     */
    GenerationJob cancel(UUID jobId);

    /**
     * Tenant-checked cancel used by the API.
     */
    GenerationJob cancel(UUID tenantId, UUID jobId);

    /**
     * Cancel every still-active child of a parent.
     *
     * @return number of children cancelled
     */
    int cancelActiveChildren(UUID parentJobId, String message);

    /**
     * Requeue PROCESSING jobs abandoned for longer than {@code timeout}.
     *
     * @return ids of the jobs put back to QUEUED
     */
    List<UUID> reclaimStale(Duration timeout);

    GenerationJob getJob(UUID tenantId, UUID jobId);

    Optional<GenerationJob> findJob(UUID jobId);

    Page<GenerationJob> listJobs(UUID tenantId, JobFilter filter, Pageable pageable);

    boolean isCancelled(UUID jobId);

    /**
     * Optional filters for {@link #listJobs}.
     */
    record JobFilter(GenerationJobType type, GenerationJobStatus status, UUID courseId) {

        public static JobFilter none() {
            return new JobFilter(null, null, null);
        }
    }
}
