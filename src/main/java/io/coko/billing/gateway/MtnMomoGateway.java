package io.coko.billing.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.UnauthenticatedWebhookException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.CertificateFactory;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * MTN Mobile Money collections (request-to-pay). Accepted requests are pending until the callback.
 * Callbacks are signed with SHA256withRSA; the base64 signature travels in {@value #SIGNATURE_HEADER}.
 */
@Component
public class MtnMomoGateway extends AbstractHttpPaymentGateway {

	public static final String SIGNATURE_HEADER = "X-Callback-Signature";

	private final BillingEngineProperties.MtnMomo settings;
	private volatile PublicKey callbackKey;

	public MtnMomoGateway(BillingEngineProperties props, ObjectMapper objectMapper, BillingMetrics metrics,
			Clock clock) {
		super(props.getProviders().getMtnMomo().getTimeoutMs(), objectMapper, metrics, clock);
		this.settings = props.getProviders().getMtnMomo();
	}

	@Override
	public PaymentProvider provider() {
		return PaymentProvider.MTN_MOMO;
	}

	@Override
	public String signatureHeaderName() {
		return SIGNATURE_HEADER;
	}

	@Override
	@CircuitBreaker(name = "mtn_momo", fallbackMethod = "circuitOpen")
	public ChargeResult initiateCharge(ChargeRequest request) {
		HttpHeaders headers = new HttpHeaders();
		headers.setBearerAuth(settings.getAccessToken());
		headers.set("X-Reference-Id", request.getIdempotencyKey());
		headers.set("X-Target-Environment", settings.getTargetEnvironment());
		headers.set("Ocp-Apim-Subscription-Key", settings.getSubscriptionKey());
		if (settings.getCallbackUrl() != null) {
			headers.set("X-Callback-Url", settings.getCallbackUrl());
		}

		Map<String, Object> payer = new HashMap<>();
		payer.put("partyIdType", "MSISDN");
		payer.put("partyId", request.getPaymentMethodRef());
		Map<String, Object> body = new HashMap<>();
		body.put("amount", request.getAmount().toMajor().toPlainString());
		body.put("currency", request.getAmount().getCurrency().getCode());
		body.put("externalId", request.getSubjectRef().toString());
		body.put("payer", payer);
		body.put("payerMessage", request.getDescription());
		body.put("payeeNote", request.getDescription());

		ProviderResponse response = postJson("requesttopay",
			settings.getBaseUrl() + settings.getRequestToPayPath(), headers, body);
		if (response.getStatusCode() == 409) {
			// reference id already accepted earlier, same request
			log.info("MTN MoMo request already accepted: attemptId={}", request.getAttemptId());
			return ChargeResult.pending(request.getIdempotencyKey());
		}
		if (!response.isSuccessful()) {
			String code = Optional.ofNullable(bodyText(response.getBody(), "code")).orElse("momo_rejected");
			throw ProviderException.permanentFailure(provider(), code,
				"MTN MoMo request-to-pay rejected with status " + response.getStatusCode());
		}
		return ChargeResult.pending(request.getIdempotencyKey());
	}

	public ChargeResult circuitOpen(ChargeRequest request, CallNotPermittedException e) {
		throw ProviderException.transientFailure(provider(), "MTN MoMo circuit breaker open", e);
	}

	@Override
	public void verifyWebhookSignature(byte[] rawPayload, String signatureHeader) {
		if (signatureHeader == null || signatureHeader.isBlank()) {
			throw new UnauthenticatedWebhookException(provider(), "Missing callback signature");
		}
		byte[] signature;
		try {
			signature = Base64.getDecoder().decode(signatureHeader.trim());
		} catch (IllegalArgumentException e) {
			throw new UnauthenticatedWebhookException(provider(), "Callback signature is not base64", e);
		}
		try {
			Signature verifier = Signature.getInstance("SHA256withRSA");
			verifier.initVerify(callbackKey());
			verifier.update(rawPayload);
			if (!verifier.verify(signature)) {
				throw new UnauthenticatedWebhookException(provider(), "Callback signature mismatch");
			}
		} catch (GeneralSecurityException e) {
			throw new UnauthenticatedWebhookException(provider(), "Callback signature could not be verified", e);
		}
	}

	private PublicKey callbackKey() throws GeneralSecurityException {
		PublicKey key = callbackKey;
		if (key == null) {
			key = parsePublicKey(settings.getCallbackPublicKey());
			callbackKey = key;
		}
		return key;
	}

	/**
	 * Accepts either a PEM X.509 certificate or a PEM/base64 SubjectPublicKeyInfo RSA key.
	 */
	static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
		if (pem == null || pem.isBlank()) {
			throw new GeneralSecurityException("No callback public key configured");
		}
		if (pem.contains("BEGIN CERTIFICATE")) {
			CertificateFactory factory = CertificateFactory.getInstance("X.509");
			return factory.generateCertificate(new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)))
				.getPublicKey();
		}
		String base64 = pem
			.replace("-----BEGIN PUBLIC KEY-----", "")
			.replace("-----END PUBLIC KEY-----", "")
			.replaceAll("\\s", "");
		byte[] der;
		try {
			der = Base64.getDecoder().decode(base64);
		} catch (IllegalArgumentException e) {
			throw new GeneralSecurityException("Callback public key is not valid base64", e);
		}
		return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
	}

	@Override
	public Optional<PaymentTransaction> normalizeWebhookPayload(byte[] rawPayload) {
		JsonNode payload = readPayload(rawPayload);
		String status = requireText(payload, "status").toUpperCase();
		TransactionStatus txStatus;
		switch (status) {
			case "SUCCESSFUL":
				txStatus = TransactionStatus.SETTLED;
				break;
			case "FAILED":
			case "REJECTED":
			case "TIMEOUT":
				txStatus = TransactionStatus.FAILED;
				break;
			case "PENDING":
				log.debug("MTN MoMo callback without money movement: status={}", status);
				return Optional.empty();
			default:
				throw new ValidationException("Unknown MTN MoMo status: " + status, "status", status);
		}

		String txnId = Optional.ofNullable(text(payload, "financialTransactionId"))
			.orElse(text(payload, "referenceId"));
		if (txnId == null) {
			throw new ValidationException("MTN MoMo callback has neither financialTransactionId nor referenceId",
				"financialTransactionId", null);
		}
		CurrencyCode currency = requireCurrency(payload, "currency");
		String amountText = requireText(payload, "amount");
		Money amount;
		try {
			amount = Money.ofMajor(new BigDecimal(amountText.trim()), currency);
		} catch (NumberFormatException e) {
			throw new ValidationException("Malformed amount: " + amountText, e);
		}
		Instant now = clock.instant();

		PaymentTransaction.Builder builder = PaymentTransaction.builder()
			.externalRef(provider(), txnId)
			.amount(amount)
			.kind(TransactionKind.CHARGE)
			.status(txStatus)
			.subjectRef(optionalSubject(text(payload, "externalId")))
			.authorRef(text(payload, "authorRef"))
			.payerRef(Optional.ofNullable(text(payload, "userRef")).orElse(text(payload.path("payer"), "partyId")))
			.revenueStream(RevenueStream.fromCode(text(payload, "revenueStream")))
			.createdAt(now);
		if (txStatus == TransactionStatus.SETTLED) {
			builder.settledAt(now);
		} else {
			String reason = text(payload.path("reason"), "code");
			builder.failureCode(reason != null ? reason.toLowerCase() : status.toLowerCase());
		}
		return Optional.of(builder.build());
	}
}
