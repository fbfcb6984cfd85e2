package io.coko.billing.subscription;

public enum SubscriptionStatus {
	ACTIVE("ACTIVE"),
	RENEWAL_PENDING("RENEWAL_PENDING"),
	PAUSED("PAUSED"),
	PAST_DUE("PAST_DUE"),
	CANCELLED("CANCELLED"),
	EXPIRED("EXPIRED");

	private final String code;

	SubscriptionStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public boolean isTerminal() {
		return this == CANCELLED || this == EXPIRED;
	}

	@Override
	public String toString() {
		return code;
	}

	public static SubscriptionStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (SubscriptionStatus status : values()) {
			if (status.code.equalsIgnoreCase(code)) {
				return status;
			}
		}
		return null;
	}
}
