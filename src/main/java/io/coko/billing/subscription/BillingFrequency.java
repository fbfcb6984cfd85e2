package io.coko.billing.subscription;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Billing periods advance by calendar months in UTC; a period starting on the 31st ends on the
 * last day of a shorter month.
 */
public enum BillingFrequency {
	MONTHLY("MONTHLY", 1),
	QUARTERLY("QUARTERLY", 3),
	ANNUAL("ANNUAL", 12);

	private final String code;
	private final int months;

	BillingFrequency(String code, int months) {
		this.code = code;
		this.months = months;
	}

	public String getCode() {
		return code;
	}

	public int getMonths() {
		return months;
	}

	public Instant next(Instant periodStart) {
		return periodStart.atOffset(ZoneOffset.UTC).plusMonths(months).toInstant();
	}

	public static BillingFrequency fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (BillingFrequency frequency : values()) {
			if (frequency.code.equalsIgnoreCase(code.trim())) {
				return frequency;
			}
		}
		return null;
	}
}
