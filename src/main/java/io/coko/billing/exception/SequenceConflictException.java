package io.coko.billing.exception;

/**
 * Two invoices claimed the same sequence number for a billing entity.
 * The caller retries the allocation.
 */
public class SequenceConflictException extends BillingException {

    private final String billingEntity;
    private final long sequenceNumber;

    public SequenceConflictException(String billingEntity, long sequenceNumber, Throwable cause) {
        super("conflict", "Invoice sequence conflict: entity=" + billingEntity + " seq=" + sequenceNumber, cause);
        this.billingEntity = billingEntity;
        this.sequenceNumber = sequenceNumber;
    }

    public String getBillingEntity() {
        return billingEntity;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }
}
