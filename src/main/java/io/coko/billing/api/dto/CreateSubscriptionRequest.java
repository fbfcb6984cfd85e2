package io.coko.billing.api.dto;

import java.time.Instant;

public class CreateSubscriptionRequest {

	private String userRef;
	private String planCode;
	private Long priceMinor;
	private String currency;
	private String frequency;
	private String provider;
	private String paymentMethodRef;
	private Instant startAt;
	private Integer totalCycles;

	public String getUserRef() {
		return userRef;
	}

	public void setUserRef(String userRef) {
		this.userRef = userRef;
	}

	public String getPlanCode() {
		return planCode;
	}

	public void setPlanCode(String planCode) {
		this.planCode = planCode;
	}

	public Long getPriceMinor() {
		return priceMinor;
	}

	public void setPriceMinor(Long priceMinor) {
		this.priceMinor = priceMinor;
	}

	public String getCurrency() {
		return currency;
	}

	public void setCurrency(String currency) {
		this.currency = currency;
	}

	public String getFrequency() {
		return frequency;
	}

	public void setFrequency(String frequency) {
		this.frequency = frequency;
	}

	public String getProvider() {
		return provider;
	}

	public void setProvider(String provider) {
		this.provider = provider;
	}

	public String getPaymentMethodRef() {
		return paymentMethodRef;
	}

	public void setPaymentMethodRef(String paymentMethodRef) {
		this.paymentMethodRef = paymentMethodRef;
	}

	public Instant getStartAt() {
		return startAt;
	}

	public void setStartAt(Instant startAt) {
		this.startAt = startAt;
	}

	public Integer getTotalCycles() {
		return totalCycles;
	}

	public void setTotalCycles(Integer totalCycles) {
		this.totalCycles = totalCycles;
	}
}
