package uk.gegc.coursemaker.features.queue.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTask;
import uk.gegc.coursemaker.features.queue.domain.model.QueueTaskStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface QueueTaskRepository extends JpaRepository<QueueTask, UUID> {

    /**
     * Visible tasks in delivery order: pending tasks that are due, plus in-flight tasks whose
     * lease has run out.
     */
    @Query("""
        SELECT t FROM QueueTask t
        WHERE t.taskType IN :types
          AND ((t.status = :pending AND t.availableAt <= :now)
            OR (t.status = :inFlight AND t.leaseExpiresAt < :now))
        ORDER BY t.priority ASC, t.availableAt ASC, t.createdAt ASC
    """)
    List<QueueTask> findVisible(@Param("types") Collection<String> types,
                                @Param("pending") QueueTaskStatus pending,
                                @Param("inFlight") QueueTaskStatus inFlight,
                                @Param("now") LocalDateTime now,
                                Pageable pageable);

    /**
     * Takes a lease on a visible task. {@code expectedDeliveries} makes two consumers racing
     * for the same expired lease resolve to a single winner.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE QueueTask t
        SET t.status = :inFlight,
            t.deliveries = t.deliveries + 1,
            t.leaseExpiresAt = :leaseExpiresAt,
            t.lockedBy = :consumerId
        WHERE t.id = :id
          AND t.deliveries = :expectedDeliveries
          AND ((t.status = :pending AND t.availableAt <= :now)
            OR (t.status = :inFlight AND t.leaseExpiresAt < :now))
    """)
    int claim(@Param("id") UUID id,
              @Param("expectedDeliveries") int expectedDeliveries,
              @Param("pending") QueueTaskStatus pending,
              @Param("inFlight") QueueTaskStatus inFlight,
              @Param("now") LocalDateTime now,
              @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
              @Param("consumerId") String consumerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE QueueTask t
        SET t.status = :pending,
            t.availableAt = :availableAt,
            t.leaseExpiresAt = NULL,
            t.lockedBy = NULL,
            t.lastError = :error
        WHERE t.id = :id AND t.status = :inFlight AND t.deliveries <= t.maxRetries
          AND t.lockedBy = :consumerId AND t.deliveries = :deliveries
    """)
    int release(@Param("id") UUID id,
                @Param("consumerId") String consumerId,
                @Param("deliveries") int deliveries,
                @Param("inFlight") QueueTaskStatus inFlight,
                @Param("pending") QueueTaskStatus pending,
                @Param("availableAt") LocalDateTime availableAt,
                @Param("error") String error);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE QueueTask t
        SET t.status = :deadLetter,
            t.leaseExpiresAt = NULL,
            t.lockedBy = NULL,
            t.lastError = :error,
            t.deadLetteredAt = :now
        WHERE t.id = :id AND t.status = :inFlight
          AND t.lockedBy = :consumerId AND t.deliveries = :deliveries
    """)
    int deadLetter(@Param("id") UUID id,
                   @Param("consumerId") String consumerId,
                   @Param("deliveries") int deliveries,
                   @Param("inFlight") QueueTaskStatus inFlight,
                   @Param("deadLetter") QueueTaskStatus deadLetter,
                   @Param("error") String error,
                   @Param("now") LocalDateTime now);

    /**
     * Dead-letters an abandoned task that has no deliveries left. The lease check keeps a
     * task alone once a live consumer holds it again.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE QueueTask t
        SET t.status = :deadLetter,
            t.leaseExpiresAt = NULL,
            t.lockedBy = NULL,
            t.lastError = :error,
            t.deadLetteredAt = :now
        WHERE t.id = :id AND t.status = :inFlight AND t.leaseExpiresAt < :now AND t.deliveries > t.maxRetries
    """)
    int deadLetterExpired(@Param("id") UUID id,
                          @Param("inFlight") QueueTaskStatus inFlight,
                          @Param("deadLetter") QueueTaskStatus deadLetter,
                          @Param("error") String error,
                          @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE QueueTask t
        SET t.status = :pending,
            t.deliveries = 0,
            t.availableAt = :now,
            t.deadLetteredAt = NULL
        WHERE t.id = :id AND t.status = :deadLetter
    """)
    int requeueDeadLetter(@Param("id") UUID id,
                          @Param("deadLetter") QueueTaskStatus deadLetter,
                          @Param("pending") QueueTaskStatus pending,
                          @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        DELETE FROM QueueTask t
        WHERE t.id = :id AND t.status = :inFlight
          AND t.lockedBy = :consumerId AND t.deliveries = :deliveries
    """)
    int deleteLeased(@Param("id") UUID id,
                     @Param("consumerId") String consumerId,
                     @Param("deliveries") int deliveries,
                     @Param("inFlight") QueueTaskStatus inFlight);

    Page<QueueTask> findByStatus(QueueTaskStatus status, Pageable pageable);

    long countByStatus(QueueTaskStatus status);
}
