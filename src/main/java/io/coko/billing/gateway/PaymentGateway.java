package io.coko.billing.gateway;

import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.UnauthenticatedWebhookException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;

import java.util.Optional;

/**
 * Uniform contract over one payment provider.
 */
public interface PaymentGateway {

	PaymentProvider provider();

	/**
	 * Ask the provider to charge. A decline comes back as a FAILED result.
	 * @throws ProviderException TRANSIENT for outages and timeouts, PERMANENT for rejected requests
	 */
	ChargeResult initiateCharge(ChargeRequest request);

	/**
	 * @throws UnauthenticatedWebhookException when the signature is missing or does not match
	 */
	void verifyWebhookSignature(byte[] rawPayload, String signatureHeader);

	/**
	 * Translate a verified notification into a ledger transaction.
	 * @return empty when the event carries no money movement
	 * @throws ValidationException when the payload cannot be parsed
	 */
	Optional<PaymentTransaction> normalizeWebhookPayload(byte[] rawPayload);

	/**
	 * Name of the HTTP header carrying the provider's signature or token.
	 */
	String signatureHeaderName();
}
