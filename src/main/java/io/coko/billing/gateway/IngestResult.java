package io.coko.billing.gateway;

import java.util.UUID;

public class IngestResult {

	public enum Outcome {
		INSERTED("inserted"),
		DUPLICATE("duplicate"),
		IGNORED("ignored");

		private final String code;

		Outcome(String code) {
			this.code = code;
		}

		public String getCode() {
			return code;
		}
	}

	private final Outcome outcome;
	private final UUID transactionId;

	private IngestResult(Outcome outcome, UUID transactionId) {
		this.outcome = outcome;
		this.transactionId = transactionId;
	}

	public static IngestResult inserted(UUID transactionId) {
		return new IngestResult(Outcome.INSERTED, transactionId);
	}

	public static IngestResult duplicate(UUID existingTransactionId) {
		return new IngestResult(Outcome.DUPLICATE, existingTransactionId);
	}

	public static IngestResult ignored() {
		return new IngestResult(Outcome.IGNORED, null);
	}

	public Outcome getOutcome() {
		return outcome;
	}

	/**
	 * Ledger id of the inserted row, or of the existing row for a duplicate. Null when ignored.
	 */
	public UUID getTransactionId() {
		return transactionId;
	}

	@Override
	public String toString() {
		return "IngestResult{" + outcome.getCode() + ", transactionId=" + transactionId + "}";
	}
}
