package uk.gegc.coursemaker.features.notification.application;

import uk.gegc.coursemaker.features.notification.api.dto.NotificationDto;
import uk.gegc.coursemaker.features.notification.api.dto.NotificationPageDto;

import java.util.List;
import java.util.UUID;

public interface NotificationService {

    /**
     * Store the notification, then push it to the owner's live connections after commit.
     */
    NotificationDto create(NewNotification notification);

    /**
     * @param cursor opaque position from a previous page, or null for the newest notifications
     * @param limit  page size; values outside 1..max fall back to the default or the maximum
     */
    NotificationPageDto list(UUID tenantId, UUID userId, String cursor, Integer limit, boolean unreadOnly);

    long unreadCount(UUID tenantId, UUID userId);

    /**
     * Ids that do not belong to the caller are ignored.
     *
     * @return number of notifications that changed from unread to read
     */
    int markAsRead(UUID tenantId, UUID userId, List<UUID> ids);

    int markAllAsRead(UUID tenantId, UUID userId);

    void delete(UUID tenantId, UUID userId, UUID notificationId);
}
