package uk.gegc.coursemaker.features.notification.application.push;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.coursemaker.features.notification.domain.event.NotificationCreatedEvent;

/**
 * Pushes a notification once its row is committed. Push failures never reach the creator.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationPushListener {

    static final String EVENT_NAME = "notification";

    private final NotificationPublisher publisher;

    @Async("notificationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotificationCreated(NotificationCreatedEvent event) {
        String channel = NotificationPublisher.channelFor(event.tenantId(), event.userId());
        try {
            publisher.publish(channel, EVENT_NAME, event.notification());
        } catch (RuntimeException e) {
            log.warn("Failed to push notification {} on {}", event.notification().id(), channel, e);
        }
    }
}
