package io.coko.billing.royalty;

public enum RoyaltyStatus {
	/** Below the payout threshold; carried into the next computation. */
	ACCRUED,
	PAYABLE,
	/** On an issued royalty invoice, waiting for the payout. */
	INVOICED,
	/** Paid out. The period is frozen from here on. */
	PAID
}
