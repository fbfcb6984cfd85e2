package io.coko.billing.subscription;

public enum ChargeAttemptStatus {
	/** Sent, or about to be sent; outcome unknown. */
	PENDING,
	SETTLED,
	/** Declined or permanently rejected; counts towards dunning. */
	FAILED,
	/** Transient provider failure; the next tick resends with the same attempt id. */
	ERROR
}
