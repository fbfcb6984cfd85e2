package io.coko.billing.gateway;

import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.money.Money;

import java.util.UUID;

/**
 * One charge against a stored payment method.
 * The attempt id doubles as the provider idempotency key, so resending the same
 * request never charges twice.
 */
public class ChargeRequest {

	private final UUID attemptId;
	private final SubjectRef subjectRef;
	private final Money amount;
	private final String paymentMethodRef;
	private final String userRef;
	private final String description;

	public ChargeRequest(UUID attemptId, SubjectRef subjectRef, Money amount, String paymentMethodRef,
			String userRef, String description) {
		this.attemptId = attemptId;
		this.subjectRef = subjectRef;
		this.amount = amount;
		this.paymentMethodRef = paymentMethodRef;
		this.userRef = userRef;
		this.description = description;
	}

	public UUID getAttemptId() {
		return attemptId;
	}

	public String getIdempotencyKey() {
		return attemptId.toString();
	}

	public SubjectRef getSubjectRef() {
		return subjectRef;
	}

	public Money getAmount() {
		return amount;
	}

	public String getPaymentMethodRef() {
		return paymentMethodRef;
	}

	public String getUserRef() {
		return userRef;
	}

	public String getDescription() {
		return description;
	}
}
