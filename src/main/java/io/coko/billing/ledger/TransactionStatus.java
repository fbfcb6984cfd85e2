package io.coko.billing.ledger;

/**
 * Status of a ledger row. A refund with status REVERSED is a chargeback: money was pulled
 * back by the provider rather than returned by us.
 */
public enum TransactionStatus {
	PENDING("PENDING"),
	SETTLED("SETTLED"),
	FAILED("FAILED"),
	REVERSED("REVERSED");

	private final String code;

	TransactionStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public static TransactionStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (TransactionStatus status : values()) {
			if (status.code.equalsIgnoreCase(code)) {
				return status;
			}
		}
		return null;
	}
}
