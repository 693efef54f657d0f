package uk.gegc.coursemaker.features.notification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for in-app notifications and their real-time push.
 */
@Data
@Component
@ConfigurationProperties(prefix = "coursemaker.notifications")
public class NotificationProperties {

    /**
     * Push new notifications to connected SSE clients. When false, notifications are only stored.
     * Default: true
     */
    private boolean pushEnabled = true;

    /**
     * Lifetime of one SSE connection before the client has to reconnect.
     * Default: 30 minutes
     */
    private Duration sseTimeout = Duration.ofMinutes(30);

    /**
     * Default: 20
     */
    private int defaultPageSize = 20;

    /**
     * Default: 100
     */
    private int maxPageSize = 100;

    /**
     * How long a cached unread count may be served.
     * Default: 60 seconds
     */
    private Duration unreadCountTtl = Duration.ofSeconds(60);
}
