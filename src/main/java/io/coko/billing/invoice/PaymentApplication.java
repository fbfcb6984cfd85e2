package io.coko.billing.invoice;

/**
 * What {@link InvoiceManager#applyPayment} did with a settled payment.
 */
public enum PaymentApplication {
	/** Applied total reached the invoice total; the invoice is now PAID. */
	PAID,
	/** Recorded against the invoice but the total is not covered yet. */
	PARTIAL,
	/** Invoice was already PAID; nothing changed. */
	ALREADY_PAID,
	/** Invoice is VOID; the payment is flagged for review and never applied. */
	FLAGGED_VOID
}
