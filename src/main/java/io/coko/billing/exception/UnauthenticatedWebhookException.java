package io.coko.billing.exception;

import io.coko.billing.ledger.PaymentProvider;

/**
 * Webhook signature or token did not verify. The ledger is never touched.
 */
public class UnauthenticatedWebhookException extends BillingException {

    private final PaymentProvider provider;

    public UnauthenticatedWebhookException(PaymentProvider provider, String message) {
        super("unauthenticated", message);
        this.provider = provider;
    }

    public UnauthenticatedWebhookException(PaymentProvider provider, String message, Throwable cause) {
        super("unauthenticated", message, cause);
        this.provider = provider;
    }

    public PaymentProvider getProvider() {
        return provider;
    }
}
