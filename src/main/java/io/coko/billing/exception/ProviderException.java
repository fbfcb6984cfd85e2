package io.coko.billing.exception;

import io.coko.billing.ledger.PaymentProvider;

/**
 * Failure reported by (or while talking to) a payment provider.
 * {@link Kind#TRANSIENT} failures are retried with backoff; {@link Kind#PERMANENT}
 * failures end the current charge attempt.
 */
public class ProviderException extends BillingException {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final PaymentProvider provider;
    private final Kind kind;
    private final String providerCode;

    public ProviderException(PaymentProvider provider, Kind kind, String providerCode, String message) {
        super("payment_failed", message);
        this.provider = provider;
        this.kind = kind;
        this.providerCode = providerCode;
    }

    public ProviderException(PaymentProvider provider, Kind kind, String providerCode, String message, Throwable cause) {
        super("payment_failed", message, cause);
        this.provider = provider;
        this.kind = kind;
        this.providerCode = providerCode;
    }

    public static ProviderException transientFailure(PaymentProvider provider, String message, Throwable cause) {
        return new ProviderException(provider, Kind.TRANSIENT, "TRANSIENT", message, cause);
    }

    public static ProviderException permanentFailure(PaymentProvider provider, String providerCode, String message) {
        return new ProviderException(provider, Kind.PERMANENT, providerCode, message);
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public PaymentProvider getProvider() {
        return provider;
    }

    public Kind getKind() {
        return kind;
    }

    public String getProviderCode() {
        return providerCode;
    }

    @Override
    public String toString() {
        return String.format("ProviderException{provider=%s, kind=%s, providerCode='%s', message='%s'}",
                provider, kind, providerCode, getMessage());
    }
}
