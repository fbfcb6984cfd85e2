package io.coko.billing.ledger;

public enum PaymentProvider {
	CARD("card"),
	ORANGE_MONEY("orange_money"),
	MTN_MOMO("mtn_momo");

	private final String code;

	PaymentProvider(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	/**
	 * Accepts the code ({@code orange_money}), its dashed form ({@code orange-money})
	 * or the enum name.
	 * @return PaymentProvider, or null if not found
	 */
	public static PaymentProvider fromCode(String code) {
		if (code == null) {
			return null;
		}
		String normalized = code.trim().replace('-', '_');
		for (PaymentProvider provider : values()) {
			if (provider.code.equalsIgnoreCase(normalized) || provider.name().equalsIgnoreCase(normalized)) {
				return provider;
			}
		}
		return null;
	}
}
