package uk.gegc.coursemaker.features.notification.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.coursemaker.features.notification.domain.model.Notification;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every query is scoped to one tenant and one user. Lists are keyset-paginated on
 * {@code (createdAt, id)}, newest first.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    @Query("""
        SELECT n FROM Notification n
        WHERE n.tenantId = :tenantId AND n.userId = :userId
          AND (:unreadOnly = false OR n.read = false)
        ORDER BY n.createdAt DESC, n.id DESC
    """)
    List<Notification> findFirstPage(@Param("tenantId") UUID tenantId,
                                     @Param("userId") UUID userId,
                                     @Param("unreadOnly") boolean unreadOnly,
                                     Pageable pageable);

    @Query("""
        SELECT n FROM Notification n
        WHERE n.tenantId = :tenantId AND n.userId = :userId
          AND (:unreadOnly = false OR n.read = false)
          AND (n.createdAt < :createdAt OR (n.createdAt = :createdAt AND n.id < :id))
        ORDER BY n.createdAt DESC, n.id DESC
    """)
    List<Notification> findPageAfter(@Param("tenantId") UUID tenantId,
                                     @Param("userId") UUID userId,
                                     @Param("unreadOnly") boolean unreadOnly,
                                     @Param("createdAt") LocalDateTime createdAt,
                                     @Param("id") UUID id,
                                     Pageable pageable);

    long countByTenantIdAndUserIdAndReadFalse(UUID tenantId, UUID userId);

    Optional<Notification> findByIdAndTenantIdAndUserId(UUID id, UUID tenantId, UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Notification n
        SET n.read = true, n.readAt = :now
        WHERE n.tenantId = :tenantId AND n.userId = :userId AND n.id IN :ids AND n.read = false
    """)
    int markRead(@Param("tenantId") UUID tenantId,
                 @Param("userId") UUID userId,
                 @Param("ids") Collection<UUID> ids,
                 @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Notification n
        SET n.read = true, n.readAt = :now
        WHERE n.tenantId = :tenantId AND n.userId = :userId AND n.read = false
    """)
    int markAllRead(@Param("tenantId") UUID tenantId,
                    @Param("userId") UUID userId,
                    @Param("now") LocalDateTime now);
}
