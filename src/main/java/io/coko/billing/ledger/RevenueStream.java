package io.coko.billing.ledger;

/**
 * How an author earned a transaction. Each stream carries its own royalty rate.
 */
public enum RevenueStream {
	DIRECT_SALE("DIRECT_SALE"),
	SUBSCRIPTION_READ("SUBSCRIPTION_READ"),
	TIP("TIP");

	private final String code;

	RevenueStream(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public static RevenueStream fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (RevenueStream stream : values()) {
			if (stream.code.equalsIgnoreCase(code.trim())) {
				return stream;
			}
		}
		return null;
	}
}
