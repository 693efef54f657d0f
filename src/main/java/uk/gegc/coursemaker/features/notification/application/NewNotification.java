package uk.gegc.coursemaker.features.notification.application;

import lombok.Builder;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationPriority;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationType;

import java.util.UUID;

@Builder
public record NewNotification(
        UUID tenantId,
        UUID userId,
        NotificationType type,
        NotificationPriority priority,
        String title,
        String message,
        String actionUrl,
        UUID jobId,
        UUID courseId,
        UUID taskId,
        UUID smeId
) {
}
