package uk.gegc.coursemaker.features.notification.api.dto;

public record UnreadCountDto(long count) {
}
