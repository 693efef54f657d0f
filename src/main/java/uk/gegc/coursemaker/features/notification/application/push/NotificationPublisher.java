package uk.gegc.coursemaker.features.notification.application.push;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * Best-effort real-time delivery of notifications to connected clients.
 */
public interface NotificationPublisher {

    static String channelFor(UUID tenantId, UUID userId) {
        return "events:tenant:" + tenantId + ":user:" + userId;
    }

    /**
     * Deliver an event to every subscriber of the channel. Never throws.
     */
    void publish(String channel, String eventName, Object payload);

    SseEmitter subscribe(String channel);
}
