package uk.gegc.coursemaker.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

/**
 * MDC fields shared by all log lines of one webhook delivery.
 */
@Data
@Builder
public class WebhookLoggingContext {

    static final String EVENT_ID = "eventId";
    static final String EVENT_TYPE = "eventType";
    static final String SESSION_ID = "sessionId";

    private String eventId;
    private String eventType;
    private String sessionId;

    public void setMDC() {
        if (eventId != null) MDC.put(EVENT_ID, eventId);
        if (eventType != null) MDC.put(EVENT_TYPE, eventType);
        if (sessionId != null) MDC.put(SESSION_ID, sessionId);
    }

    public void withSessionId(String sessionId) {
        this.sessionId = sessionId;
        setMDC();
    }

    public static void clearMDC() {
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_TYPE);
        MDC.remove(SESSION_ID);
    }
}
