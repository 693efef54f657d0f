package uk.gegc.coursemaker.features.job.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.coursemaker.features.job.application.GenerationJobMetrics;
import uk.gegc.coursemaker.features.job.application.GenerationJobPayloadCodec;
import uk.gegc.coursemaker.features.job.application.GenerationJobService;
import uk.gegc.coursemaker.features.job.config.JobProperties;
import uk.gegc.coursemaker.features.job.domain.event.GenerationJobTerminatedEvent;
import uk.gegc.coursemaker.features.job.domain.exception.InvalidJobStateException;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.model.payload.FullCoursePayload;
import uk.gegc.coursemaker.features.job.domain.model.payload.GenerationJobPayload;
import uk.gegc.coursemaker.features.job.domain.repository.GenerationJobRepository;
import uk.gegc.coursemaker.features.job.domain.repository.GenerationJobSpecifications;
import uk.gegc.coursemaker.shared.exception.ResourceNotFoundException;
import uk.gegc.coursemaker.shared.exception.ValidationException;
import uk.gegc.coursemaker.shared.util.ExponentialBackoff;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus.ACTIVE;
import static uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus.CANCELLED;
import static uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus.COMPLETED;
import static uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus.FAILED;
import static uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus.PROCESSING;
import static uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus.QUEUED;

/**
 * Database-backed job store. Ownership of a job is decided solely by the conditional
 * updates in {@link GenerationJobRepository}; no in-process locks are involved.
 */
@Slf4j
@Service
@Transactional
public class GenerationJobServiceImpl implements GenerationJobService {

    static final int CLAIM_CANDIDATES = 5;
    static final int MAX_ERROR_LENGTH = 2000;

    private final GenerationJobRepository jobRepository;
    private final GenerationJobPayloadCodec payloadCodec;
    private final GenerationJobMetrics metrics;
    private final ApplicationEventPublisher eventPublisher;
    private final JobProperties jobProperties;
    private final Clock clock;
    private final ExponentialBackoff backoff;

    public GenerationJobServiceImpl(GenerationJobRepository jobRepository,
                                    GenerationJobPayloadCodec payloadCodec,
                                    GenerationJobMetrics metrics,
                                    ApplicationEventPublisher eventPublisher,
                                    JobProperties jobProperties,
                                    Clock clock) {
        this.jobRepository = jobRepository;
        this.payloadCodec = payloadCodec;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.jobProperties = jobProperties;
        this.clock = clock;
        JobProperties.Backoff cfg = jobProperties.getBackoff();
        this.backoff = new ExponentialBackoff(
                Duration.ofSeconds(cfg.getBaseSeconds()),
                Duration.ofSeconds(cfg.getMaxSeconds()),
                cfg.getJitterFactor());
    }

    @Override
    public GenerationJob createJob(UUID tenantId, UUID userId, GenerationJobPayload payload) {
        if (payload == null) {
            throw new ValidationException("Job payload is required");
        }
        if (payload.jobType().isBatchParent()) {
            throw new ValidationException("FULL_COURSE jobs are created through the lesson batch endpoint");
        }
        payload.validate();

        GenerationJob job = newJob(tenantId, userId, payload);
        job.setStatus(QUEUED);
        job.setProgressPercent(0);
        job.setProgressMessage("Queued");
        job.setMaxRetries(jobProperties.getDefaultMaxRetries());

        GenerationJob saved = jobRepository.save(job);
        metrics.jobCreated(saved.getType());
        log.info("Created {} generation job with ID: {} for tenant: {}", saved.getType(), saved.getId(), tenantId);
        return saved;
    }

    @Override
    public GenerationJob createBatchParent(UUID tenantId, UUID userId, FullCoursePayload payload, String progressMessage) {
        if (payload == null) {
            throw new ValidationException("Job payload is required");
        }
        payload.validate();

        GenerationJob parent = newJob(tenantId, userId, payload);
        parent.setStatus(PROCESSING);
        parent.setStartedAt(now());
        parent.setProgressPercent(10);
        parent.setProgressMessage(progressMessage);
        parent.setMaxRetries(0);

        GenerationJob saved = jobRepository.save(parent);
        metrics.jobCreated(saved.getType());
        log.info("Created batch parent job with ID: {} for course: {}", saved.getId(), saved.getCourseId());
        return saved;
    }

    @Override
    public GenerationJob createChildJob(GenerationJob parent, GenerationJobPayload payload) {
        if (parent == null || parent.getId() == null) {
            throw new ValidationException("Parent job is required");
        }
        if (!parent.getType().isBatchParent()) {
            throw new ValidationException("Only FULL_COURSE jobs can have children");
        }
        if (parent.isChild()) {
            throw new ValidationException("A child job cannot itself have children");
        }
        if (parent.isTerminal()) {
            throw new InvalidJobStateException(parent.getId(), parent.getStatus(),
                    "Cannot add children to a job in terminal state: " + parent.getStatus());
        }
        if (payload == null) {
            throw new ValidationException("Job payload is required");
        }
        if (payload.jobType().isBatchParent()) {
            throw new ValidationException("A batch parent cannot be created as a child");
        }
        payload.validate();

        GenerationJob child = newJob(parent.getTenantId(), parent.getCreatedByUserId(), payload);
        child.setParentJobId(parent.getId());
        child.setStatus(QUEUED);
        child.setProgressPercent(0);
        child.setProgressMessage("Queued");
        child.setMaxRetries(jobProperties.getDefaultMaxRetries());

        GenerationJob saved = jobRepository.save(child);
        metrics.jobCreated(saved.getType());
        log.debug("Created child job {} under parent {}", saved.getId(), parent.getId());
        return saved;
    }

    @Override
    public Optional<GenerationJob> claimNext(Set<GenerationJobType> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return Optional.empty();
        }
        List<UUID> candidates = jobRepository.findClaimCandidates(
                QUEUED, capabilities, now(), PageRequest.of(0, CLAIM_CANDIDATES));

        for (UUID candidate : candidates) {
            Optional<GenerationJob> claimed = claim(candidate);
            if (claimed.isPresent()) {
                return claimed;
            }
            log.debug("Lost claim race for job {}; trying next candidate", candidate);
        }
        return Optional.empty();
    }

    @Override
    public Optional<GenerationJob> claim(UUID jobId) {
        int updated = jobRepository.claim(jobId, QUEUED, PROCESSING, now(), "Processing started");
        if (updated == 0) {
            return Optional.empty();
        }
        GenerationJob job = load(jobId);
        log.info("Claimed {} job {} (attempt {}/{})",
                job.getType(), jobId, job.getRetryCount() + 1, job.getMaxRetries() + 1);
        return Optional.of(job);
    }

    @Override
    public void updateProgress(UUID jobId, int percent, String message) {
        int clamped = Math.max(0, Math.min(100, percent));
        int updated = jobRepository.updateProgress(jobId, PROCESSING, clamped, message);
        if (updated == 1) {
            log.debug("Job {} progress {}%: {}", jobId, clamped, message);
            return;
        }

        GenerationJob job = load(jobId);
        if (job.getStatus() != PROCESSING) {
            throw new InvalidJobStateException(jobId, job.getStatus(),
                    "Cannot update progress for job in status: " + job.getStatus());
        }
        log.debug("Ignoring progress regression for job {}: {}% < {}%", jobId, clamped, job.getProgressPercent());
    }

    @Override
    public GenerationJob complete(UUID jobId, String resultPath, long tokensUsed) {
        LocalDateTime completedAt = now();
        int updated = jobRepository.complete(jobId, PROCESSING, COMPLETED, resultPath, Math.max(0, tokensUsed),
                "Completed", completedAt);
        GenerationJob job = load(jobId);

        if (updated == 0) {
            if (job.isTerminal()) {
                log.debug("Job {} already terminal ({}); ignoring completion", jobId, job.getStatus());
                return job;
            }
            throw new InvalidJobStateException(jobId, job.getStatus(),
                    "Cannot complete job in status: " + job.getStatus());
        }

        metrics.jobCompleted(job, completedAt);
        publishTerminated(job);
        log.info("Job {} completed; tokens used: {}", jobId, job.getTokensUsed());
        return job;
    }

    @Override
    public GenerationJob fail(UUID jobId, String errorMessage, boolean retryable) {
        GenerationJob job = load(jobId);
        if (job.isTerminal()) {
            log.debug("Job {} already terminal ({}); ignoring failure", jobId, job.getStatus());
            return job;
        }
        if (job.getStatus() != PROCESSING) {
            // Reclaimed by the watchdog while the old attempt was still running
            log.warn("Job {} is {} rather than PROCESSING; discarding late failure: {}", jobId, job.getStatus(), errorMessage);
            return job;
        }

        String error = truncate(errorMessage);
        if (retryable && job.hasRetryBudget()) {
            int attempt = job.getRetryCount() + 1;
            LocalDateTime nextAttemptAt = now().plus(backoff.delayFor(attempt));
            int updated = jobRepository.requeueForRetry(jobId, PROCESSING, QUEUED, nextAttemptAt, error,
                    "Retry " + attempt + " of " + job.getMaxRetries() + " scheduled");
            if (updated == 1) {
                metrics.jobFailed(job.getType(), true);
                log.warn("Job {} failed (retry {}/{}), requeued for {}: {}",
                        jobId, attempt, job.getMaxRetries(), nextAttemptAt, error);
                return load(jobId);
            }
        } else {
            int updated = jobRepository.markFailed(jobId, PROCESSING, FAILED, error, "Generation failed", now());
            if (updated == 1) {
                GenerationJob failed = load(jobId);
                metrics.jobFailed(job.getType(), false);
                publishTerminated(failed);
                log.error("Job {} failed permanently after {} retries: {}", jobId, failed.getRetryCount(), error);
                return failed;
            }
        }
        return load(jobId);
    }

    @Override
    public GenerationJob cancel(UUID jobId) {
        GenerationJob job = load(jobId);
        if (job.isTerminal()) {
            log.debug("Cancel requested for terminal job {} ({}); nothing to do", jobId, job.getStatus());
            return job;
        }

        int updated = jobRepository.cancel(jobId, ACTIVE, CANCELLED, "Cancelled by user", now());
        if (updated == 0) {
            return load(jobId);
        }

        if (job.getType().isBatchParent()) {
            int cascaded = cancelActiveChildren(jobId, "Cancelled: parent job cancelled");
            log.info("Cancelled {} child job(s) of parent {}", cascaded, jobId);
        }

        GenerationJob cancelled = load(jobId);
        publishTerminated(cancelled);
        log.info("Job {} cancelled (was {})", jobId, job.getStatus());
        return cancelled;
    }

    @Override
    public GenerationJob cancel(UUID tenantId, UUID jobId) {
        getJob(tenantId, jobId);
        return cancel(jobId);
    }

    @Override
    public int cancelActiveChildren(UUID parentJobId, String message) {
        int cancelled = 0;
        for (UUID childId : jobRepository.findChildIdsByStatusIn(parentJobId, ACTIVE)) {
            if (jobRepository.cancel(childId, ACTIVE, CANCELLED, message, now()) == 1) {
                cancelled++;
                jobRepository.findById(childId).ifPresent(this::publishTerminated);
            }
        }
        return cancelled;
    }

    @Override
    public List<UUID> reclaimStale(Duration timeout) {
        LocalDateTime cutoff = now().minus(timeout);
        List<GenerationJob> stale = jobRepository.findStaleJobs(PROCESSING, GenerationJobType.FULL_COURSE, cutoff);
        List<UUID> requeued = new ArrayList<>();

        for (GenerationJob job : stale) {
            if (job.hasRetryBudget()) {
                int updated = jobRepository.reclaimStale(job.getId(), PROCESSING, QUEUED, cutoff,
                        "Requeued after worker timeout");
                if (updated == 1) {
                    requeued.add(job.getId());
                    log.warn("Reclaimed stale job {} (started at {}), retry {}/{}",
                            job.getId(), job.getStartedAt(), job.getRetryCount() + 1, job.getMaxRetries());
                }
            } else {
                String error = "Job timed out after " + (job.getRetryCount() + 1) + " attempts";
                int updated = jobRepository.markFailed(job.getId(), PROCESSING, FAILED, error, "Timed out", now());
                if (updated == 1) {
                    metrics.jobFailed(job.getType(), false);
                    jobRepository.findById(job.getId()).ifPresent(this::publishTerminated);
                    log.error("Stale job {} exhausted its retries and was failed", job.getId());
                }
            }
        }

        metrics.jobsReclaimed(requeued.size());
        return requeued;
    }

    @Override
    @Transactional(readOnly = true)
    public GenerationJob getJob(UUID tenantId, UUID jobId) {
        return jobRepository.findByIdAndTenantId(jobId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Generation job not found with ID: " + jobId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GenerationJob> findJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<GenerationJob> listJobs(UUID tenantId, JobFilter filter, Pageable pageable) {
        JobFilter effective = filter != null ? filter : JobFilter.none();
        return jobRepository.findAll(
                GenerationJobSpecifications.build(tenantId, effective.type(), effective.status(), effective.courseId()),
                pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isCancelled(UUID jobId) {
        Optional<GenerationJob> job = jobRepository.findById(jobId);
        if (job.isEmpty()) {
            log.warn("Job {} disappeared while running; treating as cancelled", jobId);
            return true;
        }
        return job.get().getStatus() == CANCELLED;
    }

    private GenerationJob newJob(UUID tenantId, UUID userId, GenerationJobPayload payload) {
        if (tenantId == null) {
            throw new ValidationException("Tenant ID is required");
        }
        if (userId == null) {
            throw new ValidationException("Creating user ID is required");
        }
        GenerationJob job = new GenerationJob();
        job.setTenantId(tenantId);
        job.setCreatedByUserId(userId);
        job.setType(payload.jobType());
        job.setCourseId(payload.courseId());
        job.setLessonId(payload.lessonId());
        job.setSmeTaskId(payload.smeTaskId());
        job.setSubmissionId(payload.submissionId());
        job.setPayload(payloadCodec.write(payload));
        job.setCreatedAt(now());
        return job;
    }

    private GenerationJob load(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Generation job not found with ID: " + jobId));
    }

    private void publishTerminated(GenerationJob job) {
        eventPublisher.publishEvent(new GenerationJobTerminatedEvent(
                job.getId(), job.getTenantId(), job.getType(), job.getStatus(), job.getParentJobId()));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
