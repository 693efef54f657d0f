package uk.gegc.coursemaker.features.billing.domain.exception;

/**
 * The webhook request could not be authenticated as coming from Stripe.
 */
public class StripeWebhookInvalidSignatureException extends RuntimeException {

    public StripeWebhookInvalidSignatureException(String message) {
        super(message);
    }
}
