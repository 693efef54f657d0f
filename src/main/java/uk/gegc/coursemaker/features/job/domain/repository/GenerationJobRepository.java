package uk.gegc.coursemaker.features.job.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJob;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobStatus;
import uk.gegc.coursemaker.features.job.domain.model.GenerationJobType;
import uk.gegc.coursemaker.features.job.domain.repository.projection.ChildStatusCount;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for generation jobs.
 *
 * <p>Every status transition is a single conditional UPDATE whose WHERE clause carries the
 * expected source status. A return value of 0 means the row was not in that status (another
 * worker won, the job was cancelled, or it is already terminal), never a partial write.
 */
@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJob, UUID>,
        JpaSpecificationExecutor<GenerationJob> {

    Optional<GenerationJob> findByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * Oldest claimable jobs first. Jobs waiting out a retry backoff are skipped.
     */
    @Query("""
        SELECT j.id FROM GenerationJob j
        WHERE j.status = :status
          AND j.type IN :types
          AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now)
        ORDER BY j.createdAt ASC
    """)
    List<UUID> findClaimCandidates(@Param("status") GenerationJobStatus status,
                                   @Param("types") Collection<GenerationJobType> types,
                                   @Param("now") LocalDateTime now,
                                   Pageable pageable);

    /**
     * QUEUED -> PROCESSING. At most one concurrent caller gets 1 for the same id.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :processing,
            j.startedAt = :now,
            j.nextAttemptAt = NULL,
            j.progressMessage = :message,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status = :queued
    """)
    int claim(@Param("id") UUID id,
              @Param("queued") GenerationJobStatus queued,
              @Param("processing") GenerationJobStatus processing,
              @Param("now") LocalDateTime now,
              @Param("message") String message);

    /**
     * Progress write that never moves the percentage backwards.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.progressPercent = :percent,
            j.progressMessage = :message
        WHERE j.id = :id AND j.status = :processing AND j.progressPercent <= :percent
    """)
    int updateProgress(@Param("id") UUID id,
                       @Param("processing") GenerationJobStatus processing,
                       @Param("percent") int percent,
                       @Param("message") String message);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :completed,
            j.resultPath = :resultPath,
            j.tokensUsed = :tokensUsed,
            j.progressPercent = 100,
            j.progressMessage = :message,
            j.errorMessage = NULL,
            j.completedAt = :now,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status = :processing
    """)
    int complete(@Param("id") UUID id,
                 @Param("processing") GenerationJobStatus processing,
                 @Param("completed") GenerationJobStatus completed,
                 @Param("resultPath") String resultPath,
                 @Param("tokensUsed") long tokensUsed,
                 @Param("message") String message,
                 @Param("now") LocalDateTime now);

    /**
     * PROCESSING -> QUEUED with one more retry consumed. Refused once the budget is spent.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :queued,
            j.retryCount = j.retryCount + 1,
            j.nextAttemptAt = :nextAttemptAt,
            j.errorMessage = :error,
            j.progressMessage = :message,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status = :processing AND j.retryCount < j.maxRetries
    """)
    int requeueForRetry(@Param("id") UUID id,
                        @Param("processing") GenerationJobStatus processing,
                        @Param("queued") GenerationJobStatus queued,
                        @Param("nextAttemptAt") LocalDateTime nextAttemptAt,
                        @Param("error") String error,
                        @Param("message") String message);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :failed,
            j.errorMessage = :error,
            j.progressMessage = :message,
            j.nextAttemptAt = NULL,
            j.completedAt = :now,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status = :processing
    """)
    int markFailed(@Param("id") UUID id,
                   @Param("processing") GenerationJobStatus processing,
                   @Param("failed") GenerationJobStatus failed,
                   @Param("error") String error,
                   @Param("message") String message,
                   @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :cancelled,
            j.progressMessage = :message,
            j.nextAttemptAt = NULL,
            j.completedAt = :now,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status IN :active
    """)
    int cancel(@Param("id") UUID id,
               @Param("active") Collection<GenerationJobStatus> active,
               @Param("cancelled") GenerationJobStatus cancelled,
               @Param("message") String message,
               @Param("now") LocalDateTime now);

    @Query("SELECT j.id FROM GenerationJob j WHERE j.parentJobId = :parentJobId AND j.status IN :statuses")
    List<UUID> findChildIdsByStatusIn(@Param("parentJobId") UUID parentJobId,
                                      @Param("statuses") Collection<GenerationJobStatus> statuses);

    List<GenerationJob> findByParentJobIdOrderByCreatedAtAsc(UUID parentJobId);

    long countByParentJobId(UUID parentJobId);

    /**
     * PROCESSING jobs whose worker has not finished within the stale window. Batch parents are
     * excluded: they stay PROCESSING for as long as their children run.
     */
    @Query("""
        SELECT j FROM GenerationJob j
        WHERE j.status = :processing AND j.type <> :parentType AND j.startedAt < :cutoff
        ORDER BY j.startedAt ASC
    """)
    List<GenerationJob> findStaleJobs(@Param("processing") GenerationJobStatus processing,
                                      @Param("parentType") GenerationJobType parentType,
                                      @Param("cutoff") LocalDateTime cutoff);

    /**
     * Batch parents still PROCESSING long after they started although none of their children
     * is still active. Aggregation for them was lost and has to be re-run.
     */
    @Query("""
        SELECT j.id FROM GenerationJob j
        WHERE j.status = :processing AND j.type = :parentType AND j.startedAt < :cutoff
          AND NOT EXISTS (
            SELECT c.id FROM GenerationJob c
            WHERE c.parentJobId = j.id AND c.status IN :active
          )
        ORDER BY j.startedAt ASC
    """)
    List<UUID> findSettledParentIds(@Param("processing") GenerationJobStatus processing,
                                    @Param("parentType") GenerationJobType parentType,
                                    @Param("active") Collection<GenerationJobStatus> active,
                                    @Param("cutoff") LocalDateTime cutoff);

    /**
     * Watchdog requeue. Re-checks staleness so a job that finished meanwhile is left alone.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :queued,
            j.retryCount = j.retryCount + 1,
            j.nextAttemptAt = NULL,
            j.progressMessage = :message,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status = :processing AND j.startedAt < :cutoff AND j.retryCount < j.maxRetries
    """)
    int reclaimStale(@Param("id") UUID id,
                     @Param("processing") GenerationJobStatus processing,
                     @Param("queued") GenerationJobStatus queued,
                     @Param("cutoff") LocalDateTime cutoff,
                     @Param("message") String message);

    /**
     * Parent row lock used while aggregating children.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM GenerationJob j WHERE j.id = :id")
    Optional<GenerationJob> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT j.status AS status, COUNT(j) AS total, SUM(j.tokensUsed) AS tokens
        FROM GenerationJob j
        WHERE j.parentJobId = :parentJobId
        GROUP BY j.status
    """)
    List<ChildStatusCount> countChildrenByStatus(@Param("parentJobId") UUID parentJobId);

    /**
     * Terminal transition for a batch parent. Only the first aggregation that sees the
     * final tally wins.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE GenerationJob j
        SET j.status = :target,
            j.progressPercent = 100,
            j.progressMessage = :message,
            j.errorMessage = :error,
            j.tokensUsed = :tokensUsed,
            j.completedAt = :now,
            j.version = j.version + 1
        WHERE j.id = :id AND j.status = :processing
    """)
    int finalizeParent(@Param("id") UUID id,
                       @Param("processing") GenerationJobStatus processing,
                       @Param("target") GenerationJobStatus target,
                       @Param("message") String message,
                       @Param("error") String error,
                       @Param("tokensUsed") long tokensUsed,
                       @Param("now") LocalDateTime now);
}
