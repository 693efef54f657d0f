package uk.gegc.coursemaker.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.Webhook;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.coursemaker.features.billing.application.PendingRegistrationService;
import uk.gegc.coursemaker.features.billing.application.ProvisioningTaskHandler;
import uk.gegc.coursemaker.features.billing.application.StripeWebhookService;
import uk.gegc.coursemaker.features.billing.application.WebhookLoggingContext;
import uk.gegc.coursemaker.features.billing.config.ProvisioningProperties;
import uk.gegc.coursemaker.features.billing.config.StripeProperties;
import uk.gegc.coursemaker.features.billing.domain.exception.StripeWebhookInvalidSignatureException;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistration;
import uk.gegc.coursemaker.features.billing.domain.model.PendingRegistrationStatus;
import uk.gegc.coursemaker.features.queue.application.TaskQueue;
import uk.gegc.coursemaker.shared.exception.ValidationException;

import java.util.Optional;

/**
 * Turns a verified {@code checkout.session.completed} event into exactly one provisioning task.
 * The PENDING -> PAID compare-and-set decides which delivery of a repeated event wins.
 */
@Slf4j
@Service
public class StripeWebhookServiceImpl implements StripeWebhookService {

    static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";

    private final StripeProperties stripeProperties;
    private final ProvisioningProperties provisioningProperties;
    private final PendingRegistrationService registrationService;
    private final TaskQueue taskQueue;
    private final ObjectMapper objectMapper;
    private final Counter receivedCounter;
    private final Counter okCounter;
    private final Counter duplicateCounter;
    private final Counter failedCounter;

    public StripeWebhookServiceImpl(StripeProperties stripeProperties,
                                    ProvisioningProperties provisioningProperties,
                                    PendingRegistrationService registrationService,
                                    TaskQueue taskQueue,
                                    ObjectMapper objectMapper,
                                    MeterRegistry meterRegistry) {
        this.stripeProperties = stripeProperties;
        this.provisioningProperties = provisioningProperties;
        this.registrationService = registrationService;
        this.taskQueue = taskQueue;
        this.objectMapper = objectMapper;
        this.receivedCounter = meterRegistry.counter("stripe.webhooks.received");
        this.okCounter = meterRegistry.counter("stripe.webhooks.ok");
        this.duplicateCounter = meterRegistry.counter("stripe.webhooks.duplicate");
        this.failedCounter = meterRegistry.counter("stripe.webhooks.failed");
    }

    @Override
    public Result process(String payload, String signatureHeader) {
        String webhookSecret = stripeProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe webhook secret not configured; rejecting request");
            throw new StripeWebhookInvalidSignatureException("Webhook secret not configured");
        }

        final Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, webhookSecret);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            throw new StripeWebhookInvalidSignatureException("Invalid Stripe signature");
        }

        receivedCounter.increment();
        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(event.getId())
                .eventType(event.getType())
                .build();
        loggingContext.setMDC();
        try {
            log.info("Processing Stripe webhook event: id={} type={}", event.getId(), event.getType());
            Result result = routeEvent(event, payload, loggingContext);
            switch (result) {
                case OK, IGNORED -> okCounter.increment();
                case DUPLICATE -> duplicateCounter.increment();
            }
            return result;
        } catch (RuntimeException e) {
            failedCounter.increment();
            log.error("Failed to process webhook event: id={} type={}", event.getId(), event.getType(), e);
            throw e;
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private Result routeEvent(Event event, String payload, WebhookLoggingContext loggingContext) {
        if (CHECKOUT_SESSION_COMPLETED.equals(event.getType())) {
            return handleCheckoutSessionCompleted(event, payload, loggingContext);
        }
        log.info("Ignoring Stripe event id={} type={} (not handled)", event.getId(), event.getType());
        return Result.IGNORED;
    }

    private Result handleCheckoutSessionCompleted(Event event, String payload, WebhookLoggingContext loggingContext) {
        CheckoutDetails details = extractCheckoutDetails(event, payload);
        if (!StringUtils.hasText(details.sessionId())) {
            throw new ValidationException("Missing session id in event payload");
        }
        loggingContext.withSessionId(details.sessionId());

        Optional<PendingRegistration> registration = registrationService.findBySessionId(details.sessionId());
        if (registration.isEmpty()) {
            log.info("No pending registration for session {}; ignoring", details.sessionId());
            return Result.IGNORED;
        }
        if (registration.get().getStatus() != PendingRegistrationStatus.PENDING) {
            log.warn("Duplicate checkout completion for session {} (status {})",
                    details.sessionId(), registration.get().getStatus());
            return Result.DUPLICATE;
        }

        if (!registrationService.markPaid(details.sessionId(), details.customerId(), details.subscriptionId())) {
            log.warn("Lost PENDING -> PAID race for session {}; treating as duplicate", details.sessionId());
            return Result.DUPLICATE;
        }

        try {
            taskQueue.enqueue(ProvisioningTaskHandler.TASK_TYPE, details.sessionId(),
                    ProvisioningTaskHandler.enqueueOptions(provisioningProperties));
        } catch (RuntimeException e) {
            log.error("Registration {} is PAID but the provisioning task could not be enqueued; reconciliation will retry",
                    details.sessionId(), e);
        }
        log.info("Checkout session {} marked PAID", details.sessionId());
        return Result.OK;
    }

    private CheckoutDetails extractCheckoutDetails(Event event, String payload) {
        try {
            JsonNode object = objectMapper.readTree(payload).path("data").path("object");
            String id = object.path("id").asText(null);
            if (StringUtils.hasText(id)) {
                return new CheckoutDetails(id, object.path("customer").asText(null), object.path("subscription").asText(null));
            }
        } catch (JsonProcessingException e) {
            log.warn("Could not read checkout session from raw payload, falling back to event deserializer: {}", e.getMessage());
        }
        Optional<StripeObject> object = event.getDataObjectDeserializer().getObject();
        if (object.isPresent() && object.get() instanceof Session session) {
            return new CheckoutDetails(session.getId(), session.getCustomer(), session.getSubscription());
        }
        return new CheckoutDetails(null, null, null);
    }

    private record CheckoutDetails(String sessionId, String customerId, String subscriptionId) {
    }
}
