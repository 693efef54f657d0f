package uk.gegc.coursemaker.features.notification.domain.event;

import java.util.UUID;

/**
 * A user's unread notifications changed; their cached count is stale once the change commits.
 */
public record UnreadCountChangedEvent(UUID tenantId, UUID userId) {
}
