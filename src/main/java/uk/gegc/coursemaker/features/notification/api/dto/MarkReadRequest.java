package uk.gegc.coursemaker.features.notification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record MarkReadRequest(
        @Schema(description = "Notifications to mark as read", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "ids must not be empty")
        @Size(max = 100, message = "At most 100 notifications can be marked at once")
        List<UUID> ids
) {
}
