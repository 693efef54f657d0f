package uk.gegc.coursemaker.features.notification.api.dto;

public record MarkReadResultDto(int updated) {
}
