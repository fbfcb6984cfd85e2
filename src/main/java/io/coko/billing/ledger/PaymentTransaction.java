package io.coko.billing.ledger;

import io.coko.billing.money.Money;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One money movement reported by a provider. Immutable once committed to the ledger.
 */
public final class PaymentTransaction {

    private final UUID id;
    private final ExternalRef externalRef;
    private final Money amount;
    private final TransactionKind kind;
    private final TransactionStatus status;
    private final SubjectRef subjectRef;
    private final String authorRef;
    private final String payerRef;
    private final RevenueStream revenueStream;
    private final String failureCode;
    private final String relatedProviderTransactionId;
    private final Instant createdAt;
    private final Instant settledAt;

    private PaymentTransaction(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID();
        this.externalRef = Objects.requireNonNull(builder.externalRef, "externalRef");
        this.amount = Objects.requireNonNull(builder.amount, "amount");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.status = Objects.requireNonNull(builder.status, "status");
        this.subjectRef = builder.subjectRef;
        this.authorRef = builder.authorRef;
        this.payerRef = builder.payerRef;
        this.revenueStream = builder.revenueStream;
        this.failureCode = builder.failureCode;
        this.relatedProviderTransactionId = builder.relatedProviderTransactionId;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        this.settledAt = builder.settledAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.externalRef = externalRef;
        builder.amount = amount;
        builder.kind = kind;
        builder.status = status;
        builder.subjectRef = subjectRef;
        builder.authorRef = authorRef;
        builder.payerRef = payerRef;
        builder.revenueStream = revenueStream;
        builder.failureCode = failureCode;
        builder.relatedProviderTransactionId = relatedProviderTransactionId;
        builder.createdAt = createdAt;
        builder.settledAt = settledAt;
        return builder;
    }

    public UUID getId() {
        return id;
    }

    public ExternalRef getExternalRef() {
        return externalRef;
    }

    public PaymentProvider getProvider() {
        return externalRef.getProvider();
    }

    public String getProviderTransactionId() {
        return externalRef.getProviderTransactionId();
    }

    public Money getAmount() {
        return amount;
    }

    public TransactionKind getKind() {
        return kind;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public SubjectRef getSubjectRef() {
        return subjectRef;
    }

    public String getAuthorRef() {
        return authorRef;
    }

    /**
     * Reader who paid, when the provider reported one.
     */
    public String getPayerRef() {
        return payerRef;
    }

    public RevenueStream getRevenueStream() {
        return revenueStream;
    }

    public String getFailureCode() {
        return failureCode;
    }

    public String getRelatedProviderTransactionId() {
        return relatedProviderTransactionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getSettledAt() {
        return settledAt;
    }

    public boolean isSettledCharge() {
        return kind == TransactionKind.CHARGE && status == TransactionStatus.SETTLED;
    }

    public boolean isFailedCharge() {
        return kind == TransactionKind.CHARGE && status == TransactionStatus.FAILED;
    }

    /**
     * Refund or chargeback that took money back from us.
     */
    public boolean isMoneyReturned() {
        return kind == TransactionKind.REFUND
            && (status == TransactionStatus.SETTLED || status == TransactionStatus.REVERSED);
    }

    @Override
    public String toString() {
        return "PaymentTransaction{id=" + id + ", ref=" + externalRef + ", kind=" + kind + ", status=" + status
            + ", amount=" + amount + ", subject=" + subjectRef + "}";
    }

    public static final class Builder {
        private UUID id;
        private ExternalRef externalRef;
        private Money amount;
        private TransactionKind kind;
        private TransactionStatus status;
        private SubjectRef subjectRef;
        private String authorRef;
        private String payerRef;
        private RevenueStream revenueStream;
        private String failureCode;
        private String relatedProviderTransactionId;
        private Instant createdAt;
        private Instant settledAt;

        private Builder() {
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder externalRef(PaymentProvider provider, String providerTransactionId) {
            this.externalRef = new ExternalRef(provider, providerTransactionId);
            return this;
        }

        public Builder amount(Money amount) {
            this.amount = amount;
            return this;
        }

        public Builder kind(TransactionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(TransactionStatus status) {
            this.status = status;
            return this;
        }

        public Builder subjectRef(SubjectRef subjectRef) {
            this.subjectRef = subjectRef;
            return this;
        }

        public Builder authorRef(String authorRef) {
            this.authorRef = authorRef;
            return this;
        }

        public Builder payerRef(String payerRef) {
            this.payerRef = payerRef;
            return this;
        }

        public Builder revenueStream(RevenueStream revenueStream) {
            this.revenueStream = revenueStream;
            return this;
        }

        public Builder failureCode(String failureCode) {
            this.failureCode = failureCode;
            return this;
        }

        public Builder relatedProviderTransactionId(String relatedProviderTransactionId) {
            this.relatedProviderTransactionId = relatedProviderTransactionId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder settledAt(Instant settledAt) {
            this.settledAt = settledAt;
            return this;
        }

        public PaymentTransaction build() {
            return new PaymentTransaction(this);
        }
    }
}
