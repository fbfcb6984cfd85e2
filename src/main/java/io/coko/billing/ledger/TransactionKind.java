package io.coko.billing.ledger;

public enum TransactionKind {
	CHARGE("CHARGE"),
	REFUND("REFUND"),
	PAYOUT("PAYOUT");

	private final String code;

	TransactionKind(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public static TransactionKind fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (TransactionKind kind : values()) {
			if (kind.code.equalsIgnoreCase(code)) {
				return kind;
			}
		}
		return null;
	}
}
