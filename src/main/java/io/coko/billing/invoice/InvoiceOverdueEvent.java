package io.coko.billing.invoice;

import java.time.Instant;
import java.util.UUID;

public class InvoiceOverdueEvent {

	private final UUID invoiceId;
	private final UUID subscriptionId;
	private final Instant dueAt;
	private final Instant detectedAt;

	public InvoiceOverdueEvent(UUID invoiceId, UUID subscriptionId, Instant dueAt, Instant detectedAt) {
		this.invoiceId = invoiceId;
		this.subscriptionId = subscriptionId;
		this.dueAt = dueAt;
		this.detectedAt = detectedAt;
	}

	public UUID getInvoiceId() {
		return invoiceId;
	}

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public Instant getDueAt() {
		return dueAt;
	}

	public Instant getDetectedAt() {
		return detectedAt;
	}
}
