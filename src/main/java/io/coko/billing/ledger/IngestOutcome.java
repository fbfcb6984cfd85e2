package io.coko.billing.ledger;

public enum IngestOutcome {
	INSERTED,
	DUPLICATE
}
