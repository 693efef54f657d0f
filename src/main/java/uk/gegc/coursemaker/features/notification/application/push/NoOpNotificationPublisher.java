package uk.gegc.coursemaker.features.notification.application.push;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Used when push is switched off. Streams close immediately; clients fall back to polling.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "coursemaker.notifications.push-enabled", havingValue = "false")
public class NoOpNotificationPublisher implements NotificationPublisher {

    @Override
    public void publish(String channel, String eventName, Object payload) {
        log.trace("Push disabled; not publishing {} on {}", eventName, channel);
    }

    @Override
    public SseEmitter subscribe(String channel) {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.complete();
        return emitter;
    }
}
