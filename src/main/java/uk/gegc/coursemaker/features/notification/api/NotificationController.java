package uk.gegc.coursemaker.features.notification.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.coursemaker.features.notification.api.dto.MarkReadRequest;
import uk.gegc.coursemaker.features.notification.api.dto.MarkReadResultDto;
import uk.gegc.coursemaker.features.notification.api.dto.NotificationPageDto;
import uk.gegc.coursemaker.features.notification.api.dto.UnreadCountDto;
import uk.gegc.coursemaker.features.notification.application.NotificationService;
import uk.gegc.coursemaker.features.notification.application.push.NotificationPublisher;

import java.util.UUID;

import static uk.gegc.coursemaker.features.generation.api.GenerationController.USER_HEADER;
import static uk.gegc.coursemaker.features.job.api.GenerationJobController.TENANT_HEADER;

@Tag(name = "Notifications", description = "In-app notifications of the calling user")
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;
    private final NotificationPublisher notificationPublisher;

    @Operation(summary = "List notifications", description = "Newest first. Use nextCursor from the response to page.")
    @GetMapping
    public ResponseEntity<NotificationPageDto> list(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @Parameter(description = "Cursor returned by the previous page") @RequestParam(required = false) String cursor,
            @Parameter(description = "Page size (default 20, max 100)") @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "false") boolean unreadOnly
    ) {
        return ResponseEntity.ok(notificationService.list(tenantId, userId, cursor, limit, unreadOnly));
    }

    @Operation(summary = "Count unread notifications")
    @GetMapping("/unread-count")
    public ResponseEntity<UnreadCountDto> unreadCount(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(new UnreadCountDto(notificationService.unreadCount(tenantId, userId)));
    }

    @Operation(summary = "Mark notifications as read", description = "Ids of other users' notifications are ignored.")
    @PostMapping("/read")
    public ResponseEntity<MarkReadResultDto> markAsRead(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestBody @Valid MarkReadRequest request
    ) {
        return ResponseEntity.ok(new MarkReadResultDto(notificationService.markAsRead(tenantId, userId, request.ids())));
    }

    @Operation(summary = "Mark all notifications as read")
    @PostMapping("/read-all")
    public ResponseEntity<MarkReadResultDto> markAllAsRead(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(new MarkReadResultDto(notificationService.markAllAsRead(tenantId, userId)));
    }

    @Operation(summary = "Delete a notification")
    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID notificationId
    ) {
        notificationService.delete(tenantId, userId, notificationId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Stream new notifications", description = "Server-sent events; one 'notification' event per new notification.")
    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @RequestHeader(USER_HEADER) UUID userId
    ) {
        return notificationPublisher.subscribe(NotificationPublisher.channelFor(tenantId, userId));
    }
}
