package io.coko.billing.invoice;

import io.coko.billing.ledger.RevenueStream;

public enum ItemType {
	SUBSCRIPTION("SUBSCRIPTION", RevenueStream.SUBSCRIPTION_READ),
	BOOK_PURCHASE("BOOK_PURCHASE", RevenueStream.DIRECT_SALE),
	PREMIUM_UPGRADE("PREMIUM_UPGRADE", RevenueStream.DIRECT_SALE),
	TIP("TIP", RevenueStream.TIP),
	/** Royalties owed to an author; earns no royalty itself. */
	ROYALTY("ROYALTY", null);

	private final String code;
	private final RevenueStream revenueStream;

	ItemType(String code, RevenueStream revenueStream) {
		this.code = code;
		this.revenueStream = revenueStream;
	}

	public String getCode() {
		return code;
	}

	/**
	 * Royalty stream an author-attributed item of this type earns under.
	 */
	public RevenueStream getRevenueStream() {
		return revenueStream;
	}

	/**
	 * Item type for a purchase paid outside any invoice, from the stream it was reported under.
	 */
	public static ItemType forRevenueStream(RevenueStream stream) {
		if (stream == null) {
			return BOOK_PURCHASE;
		}
		switch (stream) {
			case SUBSCRIPTION_READ:
				return SUBSCRIPTION;
			case TIP:
				return TIP;
			default:
				return BOOK_PURCHASE;
		}
	}

	public static ItemType fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (ItemType type : values()) {
			if (type.code.equalsIgnoreCase(code.trim())) {
				return type;
			}
		}
		return null;
	}
}
