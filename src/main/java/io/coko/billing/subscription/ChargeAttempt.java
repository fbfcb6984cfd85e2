package io.coko.billing.subscription;

import io.coko.billing.ledger.PaymentProvider;

import java.time.Instant;
import java.util.UUID;

public class ChargeAttempt {

	private UUID attemptId;
	private UUID subscriptionId;
	private UUID invoiceId;
	private int attemptNumber;
	private PaymentProvider provider;
	private String providerTransactionId;
	private ChargeAttemptStatus status;
	private String failureCode;
	private Instant createdAt;
	private Instant updatedAt;

	public boolean isUnresolved() {
		return status == ChargeAttemptStatus.PENDING || status == ChargeAttemptStatus.ERROR;
	}

	public UUID getAttemptId() {
		return attemptId;
	}

	public void setAttemptId(UUID attemptId) {
		this.attemptId = attemptId;
	}

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public void setSubscriptionId(UUID subscriptionId) {
		this.subscriptionId = subscriptionId;
	}

	public UUID getInvoiceId() {
		return invoiceId;
	}

	public void setInvoiceId(UUID invoiceId) {
		this.invoiceId = invoiceId;
	}

	public int getAttemptNumber() {
		return attemptNumber;
	}

	public void setAttemptNumber(int attemptNumber) {
		this.attemptNumber = attemptNumber;
	}

	public PaymentProvider getProvider() {
		return provider;
	}

	public void setProvider(PaymentProvider provider) {
		this.provider = provider;
	}

	public String getProviderTransactionId() {
		return providerTransactionId;
	}

	public void setProviderTransactionId(String providerTransactionId) {
		this.providerTransactionId = providerTransactionId;
	}

	public ChargeAttemptStatus getStatus() {
		return status;
	}

	public void setStatus(ChargeAttemptStatus status) {
		this.status = status;
	}

	public String getFailureCode() {
		return failureCode;
	}

	public void setFailureCode(String failureCode) {
		this.failureCode = failureCode;
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
}
