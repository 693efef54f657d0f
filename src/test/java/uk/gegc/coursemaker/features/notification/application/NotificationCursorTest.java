package uk.gegc.coursemaker.features.notification.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationCursorTest {

    @Test
    @DisplayName("an encoded cursor parses back to the same position")
    void encode_parse() {
        NotificationCursor cursor = new NotificationCursor(LocalDateTime.of(2026, 3, 1, 10, 15, 30, 123_000_000),
                UUID.fromString("0b8f8d4e-4b5a-4f43-9a52-6f1f1b7c2e11"));

        String encoded = cursor.encode();

        assertThat(encoded).isEqualTo("2026-03-01T10:15:30.123|0b8f8d4e-4b5a-4f43-9a52-6f1f1b7c2e11");
        assertThat(NotificationCursor.parse(encoded)).isEqualTo(cursor);
    }

    @ParameterizedTest
    @ValueSource(strings = {"garbage", "|0b8f8d4e-4b5a-4f43-9a52-6f1f1b7c2e11", "2026-03-01T10:15:30|",
            "yesterday|0b8f8d4e-4b5a-4f43-9a52-6f1f1b7c2e11", "2026-03-01T10:15:30|not-a-uuid"})
    @DisplayName("malformed cursors are validation errors")
    void parse_malformed(String raw) {
        assertThatThrownBy(() -> NotificationCursor.parse(raw)).isInstanceOf(ValidationException.class);
    }
}
