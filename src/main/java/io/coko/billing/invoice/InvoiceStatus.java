package io.coko.billing.invoice;

public enum InvoiceStatus {
	DRAFT("DRAFT"),
	ISSUED("ISSUED"),
	PAID("PAID"),
	OVERDUE("OVERDUE"),
	VOID("VOID");

	private final String code;

	InvoiceStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	/**
	 * Issued and not yet settled or voided.
	 */
	public boolean isOpen() {
		return this == ISSUED || this == OVERDUE;
	}

	@Override
	public String toString() {
		return code;
	}

	public static InvoiceStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (InvoiceStatus status : values()) {
			if (status.code.equalsIgnoreCase(code)) {
				return status;
			}
		}
		return null;
	}
}
