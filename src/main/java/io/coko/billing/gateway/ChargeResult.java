package io.coko.billing.gateway;

public class ChargeResult {

	public enum Status {
		SETTLED,
		PENDING,
		FAILED
	}

	private final Status status;
	private final String providerTransactionId;
	private final String failureCode;

	private ChargeResult(Status status, String providerTransactionId, String failureCode) {
		this.status = status;
		this.providerTransactionId = providerTransactionId;
		this.failureCode = failureCode;
	}

	public static ChargeResult settled(String providerTransactionId) {
		return new ChargeResult(Status.SETTLED, providerTransactionId, null);
	}

	public static ChargeResult pending(String providerTransactionId) {
		return new ChargeResult(Status.PENDING, providerTransactionId, null);
	}

	public static ChargeResult failed(String providerTransactionId, String failureCode) {
		return new ChargeResult(Status.FAILED, providerTransactionId, failureCode);
	}

	public Status getStatus() {
		return status;
	}

	public String getProviderTransactionId() {
		return providerTransactionId;
	}

	public String getFailureCode() {
		return failureCode;
	}

	@Override
	public String toString() {
		return "ChargeResult{status=" + status + ", providerTransactionId=" + providerTransactionId
			+ (failureCode != null ? ", failureCode=" + failureCode : "") + "}";
	}
}
