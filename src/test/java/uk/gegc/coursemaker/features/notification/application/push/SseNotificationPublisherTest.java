package uk.gegc.coursemaker.features.notification.application.push;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import uk.gegc.coursemaker.features.notification.config.NotificationProperties;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SseNotificationPublisherTest {

    private SseNotificationPublisher publisher;
    private String channel;

    @BeforeEach
    void setUp() {
        publisher = new SseNotificationPublisher(new NotificationProperties());
        channel = NotificationPublisher.channelFor(UUID.randomUUID(), UUID.randomUUID());
    }

    @Test
    @DisplayName("channels are scoped to one user of one tenant")
    void channelFor_format() {
        UUID tenantId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();

        assertThat(NotificationPublisher.channelFor(tenantId, userId))
                .isEqualTo("events:tenant:" + tenantId + ":user:" + userId);
    }

    @Test
    @DisplayName("every open connection of a user is registered")
    void subscribe_registersEachConnection() {
        publisher.subscribe(channel);
        publisher.subscribe(channel);

        assertThat(publisher.subscriberCount(channel)).isEqualTo(2);
        assertThat(publisher.subscriberCount("events:tenant:other")).isZero();
    }

    @Test
    @DisplayName("a closed connection is dropped on the next publish while the others stay")
    void publish_dropsClosedConnection() {
        SseEmitter closed = publisher.subscribe(channel);
        publisher.subscribe(channel);
        closed.complete();

        publisher.publish(channel, "notification", "payload");

        assertThat(publisher.subscriberCount(channel)).isEqualTo(1);
    }

    @Test
    @DisplayName("publishing without subscribers is a no-op")
    void publish_noSubscribers() {
        assertThatCode(() -> publisher.publish(channel, "notification", "payload")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("the disabled publisher hands out already closed streams")
    void noOpPublisher_closedStream() {
        NoOpNotificationPublisher noOp = new NoOpNotificationPublisher();

        SseEmitter emitter = noOp.subscribe(channel);

        assertThat(emitter.getTimeout()).isZero();
        assertThatCode(() -> noOp.publish(channel, "notification", "payload")).doesNotThrowAnyException();
    }
}
