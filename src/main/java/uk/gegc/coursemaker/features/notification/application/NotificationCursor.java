package uk.gegc.coursemaker.features.notification.application;

import uk.gegc.coursemaker.features.notification.domain.model.Notification;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Keyset position in a notification list, written as {@code createdAt|id}.
 */
public record NotificationCursor(LocalDateTime createdAt, UUID id) {

    private static final String SEPARATOR = "|";

    public static NotificationCursor of(Notification last) {
        return new NotificationCursor(last.getCreatedAt(), last.getId());
    }

    public static NotificationCursor parse(String raw) {
        int split = raw.lastIndexOf(SEPARATOR);
        if (split <= 0 || split == raw.length() - 1) {
            throw new ValidationException("Invalid cursor: " + raw);
        }
        try {
            return new NotificationCursor(
                    LocalDateTime.parse(raw.substring(0, split)),
                    UUID.fromString(raw.substring(split + 1)));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new ValidationException("Invalid cursor: " + raw);
        }
    }

    public String encode() {
        return createdAt + SEPARATOR + id;
    }
}
