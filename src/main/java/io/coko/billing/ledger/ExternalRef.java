package io.coko.billing.ledger;

import java.util.Objects;

/**
 * Provider-side identity of a transaction; the ledger's idempotency key.
 */
public final class ExternalRef {

    private final PaymentProvider provider;
    private final String providerTransactionId;

    public ExternalRef(PaymentProvider provider, String providerTransactionId) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.providerTransactionId = Objects.requireNonNull(providerTransactionId, "providerTransactionId");
    }

    public PaymentProvider getProvider() {
        return provider;
    }

    public String getProviderTransactionId() {
        return providerTransactionId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExternalRef)) {
            return false;
        }
        ExternalRef that = (ExternalRef) o;
        return provider == that.provider && providerTransactionId.equals(that.providerTransactionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, providerTransactionId);
    }

    @Override
    public String toString() {
        return provider.getCode() + ":" + providerTransactionId;
    }
}
