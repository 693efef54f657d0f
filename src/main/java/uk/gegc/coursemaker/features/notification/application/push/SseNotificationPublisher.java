package uk.gegc.coursemaker.features.notification.application.push;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.coursemaker.features.notification.config.NotificationProperties;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory registry of open SSE connections, keyed by channel. A user may hold several
 * connections (tabs); each gets every event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "coursemaker.notifications.push-enabled", havingValue = "true", matchIfMissing = true)
public class SseNotificationPublisher implements NotificationPublisher {

    private final NotificationProperties properties;
    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

    @Override
    public SseEmitter subscribe(String channel) {
        SseEmitter emitter = new SseEmitter(properties.getSseTimeout().toMillis());
        emitters.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(emitter);
        emitter.onCompletion(() -> remove(channel, emitter));
        emitter.onTimeout(() -> remove(channel, emitter));
        emitter.onError(e -> remove(channel, emitter));
        log.debug("SSE subscriber added on {}", channel);
        return emitter;
    }

    @Override
    public void publish(String channel, String eventName, Object payload) {
        List<SseEmitter> subscribers = emitters.get(channel);
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        for (SseEmitter emitter : subscribers) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.warn("Dropping SSE subscriber on {}: {}", channel, e.getMessage());
                remove(channel, emitter);
            }
        }
    }

    int subscriberCount(String channel) {
        List<SseEmitter> subscribers = emitters.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void remove(String channel, SseEmitter emitter) {
        emitters.computeIfPresent(channel, (c, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
