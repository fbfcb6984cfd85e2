package io.coko.billing.configstore;

/**
 * Closed set of configuration kinds. Each kind accepts exactly one value shape.
 */
public enum ConfigType {
	ROYALTY_RATE("ROYALTY_RATE", ValueKind.DECIMAL),
	PAYOUT_THRESHOLD("PAYOUT_THRESHOLD", ValueKind.MONEY),
	TAX_RATE("TAX_RATE", ValueKind.DECIMAL),
	SUPPORTED_CURRENCIES("SUPPORTED_CURRENCIES", ValueKind.CURRENCY_LIST),
	DUNNING_SCHEDULE("DUNNING_SCHEDULE", ValueKind.DAY_LIST),
	MAX_RETRY_COUNT("MAX_RETRY_COUNT", ValueKind.INTEGER),
	PAYMENT_TERMS_DAYS("PAYMENT_TERMS_DAYS", ValueKind.INTEGER);

	public static final String DEFAULT_KEY = "default";

	public enum ValueKind {
		DECIMAL,
		MONEY,
		INTEGER,
		DAY_LIST,
		CURRENCY_LIST
	}

	private final String code;
	private final ValueKind valueKind;

	ConfigType(String code, ValueKind valueKind) {
		this.code = code;
		this.valueKind = valueKind;
	}

	public String getCode() {
		return code;
	}

	public ValueKind getValueKind() {
		return valueKind;
	}

	@Override
	public String toString() {
		return code;
	}

	public static ConfigType fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (ConfigType type : values()) {
			if (type.code.equalsIgnoreCase(code.trim())) {
				return type;
			}
		}
		return null;
	}
}
