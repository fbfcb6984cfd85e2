package io.coko.billing.money;

/**
 * Currencies the engine can hold money in, with the number of minor-unit digits
 * each one uses. The CFA francs (XOF, XAF) have no minor unit.
 */
public enum CurrencyCode {
	EUR("EUR", 2),
	USD("USD", 2),
	XOF("XOF", 0),
	XAF("XAF", 0);

	private final String code;
	private final int minorDigits;

	CurrencyCode(String code, int minorDigits) {
		this.code = code;
		this.minorDigits = minorDigits;
	}

	public String getCode() {
		return code;
	}

	public int getMinorDigits() {
		return minorDigits;
	}

	@Override
	public String toString() {
		return code;
	}

	/**
	 * Get CurrencyCode from an ISO code, case-insensitive.
	 * @param code ISO 4217 code
	 * @return CurrencyCode enum value, or null if not supported
	 */
	public static CurrencyCode fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (CurrencyCode currency : values()) {
			if (currency.code.equalsIgnoreCase(code.trim())) {
				return currency;
			}
		}
		return null;
	}
}
