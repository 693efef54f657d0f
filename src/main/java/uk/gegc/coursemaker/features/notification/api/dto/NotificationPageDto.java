package uk.gegc.coursemaker.features.notification.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "NotificationPage", description = "One page of notifications, newest first")
public record NotificationPageDto(
        List<NotificationDto> items,
        @Schema(description = "Pass as 'cursor' to fetch the next page; null on the last page")
        String nextCursor
) {
}
