package io.coko.billing.subscription;

import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.Money;

import java.time.Instant;
import java.util.UUID;

/**
 * A recurring billing arrangement for one user and plan.
 * {@code currentPeriodEnd} is the start of the next period to charge.
 */
public class Subscription {

	private UUID subscriptionId;
	private String userRef;
	private String planCode;
	private Money price;
	private BillingFrequency frequency;
	private PaymentProvider provider;
	private String paymentMethodRef;
	private SubscriptionStatus status;
	private SubscriptionStatus resumeStatus;
	private Instant startAt;
	private Instant currentPeriodEnd;
	private Instant nextRetryAt;
	private int failedAttemptCount;
	private Integer totalCycles;
	private int completedCycles;
	private long version;
	private Instant claimedAt;
	private Instant createdAt;
	private Instant updatedAt;

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public void setSubscriptionId(UUID subscriptionId) {
		this.subscriptionId = subscriptionId;
	}

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

	public SubscriptionStatus getStatus() {
		return status;
	}

	public void setStatus(SubscriptionStatus status) {
		this.status = status;
	}

	/**
	 * Status to return to when a renewal claim is released without an outcome.
	 */
	public SubscriptionStatus getResumeStatus() {
		return resumeStatus;
	}

	public void setResumeStatus(SubscriptionStatus resumeStatus) {
		this.resumeStatus = resumeStatus;
	}

	public Instant getStartAt() {
		return startAt;
	}

	public void setStartAt(Instant startAt) {
		this.startAt = startAt;
	}

	public Instant getCurrentPeriodEnd() {
		return currentPeriodEnd;
	}

	public void setCurrentPeriodEnd(Instant currentPeriodEnd) {
		this.currentPeriodEnd = currentPeriodEnd;
	}

	public Instant getNextRetryAt() {
		return nextRetryAt;
	}

	public void setNextRetryAt(Instant nextRetryAt) {
		this.nextRetryAt = nextRetryAt;
	}

	public int getFailedAttemptCount() {
		return failedAttemptCount;
	}

	public void setFailedAttemptCount(int failedAttemptCount) {
		this.failedAttemptCount = failedAttemptCount;
	}

	/**
	 * Number of paid periods after which the plan expires; null for open-ended plans.
	 */
	public Integer getTotalCycles() {
		return totalCycles;
	}

	public void setTotalCycles(Integer totalCycles) {
		this.totalCycles = totalCycles;
	}

	public int getCompletedCycles() {
		return completedCycles;
	}

	public void setCompletedCycles(int completedCycles) {
		this.completedCycles = completedCycles;
	}

	public long getVersion() {
		return version;
	}

	public void setVersion(long version) {
		this.version = version;
	}

	public Instant getClaimedAt() {
		return claimedAt;
	}

	public void setClaimedAt(Instant claimedAt) {
		this.claimedAt = claimedAt;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(Instant createdAt) {
		this.createdAt = createdAt;
	}

	public Instant getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(Instant updatedAt) {
		this.updatedAt = updatedAt;
	}

	@Override
	public String toString() {
		return "Subscription{id=" + subscriptionId + ", status=" + status + ", periodEnd=" + currentPeriodEnd
			+ ", failedAttempts=" + failedAttemptCount + ", version=" + version + "}";
	}
}
