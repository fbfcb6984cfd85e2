package io.coko.billing.subscription;

/**
 * Outcome of one {@link RecurringBillingOrchestrator#tick} call.
 */
public enum TickResult {
	NOT_DUE,
	/** Another tick claimed the subscription first. */
	CLAIM_LOST,
	/** The period invoice is already settled or void; the claim was released. */
	SKIPPED,
	PAID,
	PENDING,
	FAILED,
	CANCELLED,
	TRANSIENT_ERROR
}
