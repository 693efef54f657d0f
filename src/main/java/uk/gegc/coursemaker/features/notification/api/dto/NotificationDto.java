package uk.gegc.coursemaker.features.notification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.coursemaker.features.notification.domain.model.Notification;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationPriority;
import uk.gegc.coursemaker.features.notification.domain.model.NotificationType;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "Notification", description = "In-app notification")
public record NotificationDto(
        UUID id,
        @Schema(example = "GENERATION_COMPLETE") NotificationType type,
        @Schema(example = "NORMAL") NotificationPriority priority,
        @Schema(example = "Lesson ready") String title,
        String message,
        @Schema(description = "Where the client should navigate on click") String actionUrl,
        UUID jobId,
        UUID courseId,
        UUID taskId,
        UUID smeId,
        boolean read,
        LocalDateTime createdAt,
        LocalDateTime readAt
) {

    public static NotificationDto fromEntity(Notification n) {
        return new NotificationDto(
                n.getId(),
                n.getType(),
                n.getPriority(),
                n.getTitle(),
                n.getMessage(),
                n.getActionUrl(),
                n.getJobId(),
                n.getCourseId(),
                n.getTaskId(),
                n.getSmeId(),
                n.isRead(),
                n.getCreatedAt(),
                n.getReadAt()
        );
    }
}
