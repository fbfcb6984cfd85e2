package io.coko.billing.invoice;

import java.time.Instant;
import java.util.UUID;

/**
 * Published inside the transaction that moves an invoice to PAID, exactly once per invoice.
 */
public class InvoicePaidEvent {

	private final UUID invoiceId;
	private final UUID subscriptionId;
	private final Instant periodStart;
	private final Instant periodEnd;
	private final UUID transactionId;
	private final Instant paidAt;

	public InvoicePaidEvent(UUID invoiceId, UUID subscriptionId, Instant periodStart, Instant periodEnd,
			UUID transactionId, Instant paidAt) {
		this.invoiceId = invoiceId;
		this.subscriptionId = subscriptionId;
		this.periodStart = periodStart;
		this.periodEnd = periodEnd;
		this.transactionId = transactionId;
		this.paidAt = paidAt;
	}

	public UUID getInvoiceId() {
		return invoiceId;
	}

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public Instant getPeriodStart() {
		return periodStart;
	}

	public Instant getPeriodEnd() {
		return periodEnd;
	}

	public UUID getTransactionId() {
		return transactionId;
	}

	public Instant getPaidAt() {
		return paidAt;
	}
}
