package io.coko.billing.api.dto;

public class MarkRoyaltyPaidRequest {

	private String provider;
	private String providerTransactionId;

	public String getProvider() {
		return provider;
	}

	public void setProvider(String provider) {
		this.provider = provider;
	}

	public String getProviderTransactionId() {
		return providerTransactionId;
	}

	public void setProviderTransactionId(String providerTransactionId) {
		this.providerTransactionId = providerTransactionId;
	}
}
