package io.coko.billing.batch.model;

public enum BillingRunStatus {
	RUNNING("RUNNING"),
	COMPLETED("COMPLETED"),
	FAILED("FAILED");

	private final String code;

	BillingRunStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}
}
