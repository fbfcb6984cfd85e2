package io.coko.billing.subscription;

import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.Money;

import java.time.Instant;

/**
 * Input for {@link RecurringBillingOrchestrator#createSubscription(SubscriptionRequest)}.
 */
public class SubscriptionRequest {

	private String userRef;
	private String planCode;
	private Money price;
	private BillingFrequency frequency;
	private PaymentProvider provider;
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

	public Money getPrice() {
		return price;
	}

	public void setPrice(Money price) {
		this.price = price;
	}

	public BillingFrequency getFrequency() {
		return frequency;
	}

	public void setFrequency(BillingFrequency frequency) {
		this.frequency = frequency;
	}

	public PaymentProvider getProvider() {
		return provider;
	}

	public void setProvider(PaymentProvider provider) {
		this.provider = provider;
	}

	public String getPaymentMethodRef() {
		return paymentMethodRef;
	}

	public void setPaymentMethodRef(String paymentMethodRef) {
		this.paymentMethodRef = paymentMethodRef;
	}

	/**
	 * First charge instant; defaults to now.
	 */
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
