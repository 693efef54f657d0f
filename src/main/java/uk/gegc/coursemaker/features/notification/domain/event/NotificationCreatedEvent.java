package uk.gegc.coursemaker.features.notification.domain.event;

import uk.gegc.coursemaker.features.notification.api.dto.NotificationDto;

import java.util.UUID;

public record NotificationCreatedEvent(UUID tenantId, UUID userId, NotificationDto notification) {
}
