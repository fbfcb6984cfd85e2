package io.coko.billing.batch.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one renewal tick inside a billing run, written to {@code billing_run_item}.
 */
public class RenewalWorkItem {
	public static final String RESULT_ERROR = "ERROR";

	private UUID billingRunId;
	private UUID subscriptionId;
	private String result;
	private String failureReason;
	private Instant processedAt;

	public UUID getBillingRunId() {
		return billingRunId;
	}

	public void setBillingRunId(UUID billingRunId) {
		this.billingRunId = billingRunId;
	}

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public void setSubscriptionId(UUID subscriptionId) {
		this.subscriptionId = subscriptionId;
	}

	public String getResult() {
		return result;
	}

	public void setResult(String result) {
		this.result = result;
	}

	public String getFailureReason() {
		return failureReason;
	}

	public void setFailureReason(String failureReason) {
		this.failureReason = failureReason;
	}

	public Instant getProcessedAt() {
		return processedAt;
	}

	public void setProcessedAt(Instant processedAt) {
		this.processedAt = processedAt;
	}
}
