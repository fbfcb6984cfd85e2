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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Orange Money web payment. The customer confirms on their handset, so a charge is always
 * pending until the notification arrives. Notifications carry a shared notification token.
 */
@Component
public class OrangeMoneyGateway extends AbstractHttpPaymentGateway {

	public static final String SIGNATURE_HEADER = "X-Orange-Notification-Token";

	private final BillingEngineProperties.OrangeMoney settings;

	public OrangeMoneyGateway(BillingEngineProperties props, ObjectMapper objectMapper, BillingMetrics metrics,
			Clock clock) {
		super(props.getProviders().getOrangeMoney().getTimeoutMs(), objectMapper, metrics, clock);
		this.settings = props.getProviders().getOrangeMoney();
	}

	@Override
	public PaymentProvider provider() {
		return PaymentProvider.ORANGE_MONEY;
	}

	@Override
	public String signatureHeaderName() {
		return SIGNATURE_HEADER;
	}

	@Override
	@CircuitBreaker(name = "orange_money", fallbackMethod = "circuitOpen")
	public ChargeResult initiateCharge(ChargeRequest request) {
		HttpHeaders headers = new HttpHeaders();
		headers.setBearerAuth(settings.getAccessToken());

		Map<String, Object> body = new HashMap<>();
		body.put("merchant_key", settings.getMerchantKey());
		body.put("currency", request.getAmount().getCurrency().getCode());
		body.put("order_id", request.getIdempotencyKey());
		body.put("amount", request.getAmount().toMajor().toPlainString());
		body.put("reference", request.getSubjectRef().toString());
		body.put("notif_url", settings.getNotifyUrl());
		body.put("lang", "fr");

		ProviderResponse response = postJson("webpayment", settings.getBaseUrl() + settings.getPaymentPath(), headers, body);
		if (!response.isSuccessful()) {
			String code = Optional.ofNullable(bodyText(response.getBody(), "code")).orElse("om_rejected");
			throw ProviderException.permanentFailure(provider(), code,
				"Orange Money payment rejected with status " + response.getStatusCode());
		}
		String payToken = bodyText(response.getBody(), "pay_token");
		log.info("Orange Money payment initiated, awaiting confirmation: attemptId={} payToken={}",
			request.getAttemptId(), payToken);
		return ChargeResult.pending(payToken);
	}

	public ChargeResult circuitOpen(ChargeRequest request, CallNotPermittedException e) {
		throw ProviderException.transientFailure(provider(), "Orange Money circuit breaker open", e);
	}

	@Override
	public void verifyWebhookSignature(byte[] rawPayload, String signatureHeader) {
		String expected = settings.getNotificationToken();
		if (expected == null || expected.isBlank()) {
			throw new UnauthenticatedWebhookException(provider(), "No notification token configured");
		}
		if (signatureHeader == null || signatureHeader.isBlank()) {
			throw new UnauthenticatedWebhookException(provider(), "Missing notification token");
		}
		if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
				signatureHeader.trim().getBytes(StandardCharsets.UTF_8))) {
			throw new UnauthenticatedWebhookException(provider(), "Notification token mismatch");
		}
	}

	@Override
	public Optional<PaymentTransaction> normalizeWebhookPayload(byte[] rawPayload) {
		JsonNode payload = readPayload(rawPayload);
		String status = requireText(payload, "status").toUpperCase();
		TransactionStatus txStatus;
		switch (status) {
			case "SUCCESS":
				txStatus = TransactionStatus.SETTLED;
				break;
			case "FAILED":
			case "EXPIRED":
				txStatus = TransactionStatus.FAILED;
				break;
			case "PENDING":
			case "INITIATED":
				log.debug("Orange Money notification without money movement: status={}", status);
				return Optional.empty();
			default:
				throw new ValidationException("Unknown Orange Money status: " + status, "status", status);
		}

		String txnId = text(payload, "txnid");
		if (txnId == null && txStatus == TransactionStatus.FAILED) {
			txnId = text(payload, "order_id");
		}
		if (txnId == null) {
			throw new ValidationException("Orange Money notification is missing 'txnid'", "txnid", null);
		}
		CurrencyCode currency = requireCurrency(payload, "currency");
		Money amount = parseMajorAmount(requireText(payload, "amount"), currency);
		Instant now = clock.instant();

		PaymentTransaction.Builder builder = PaymentTransaction.builder()
			.externalRef(provider(), txnId)
			.amount(amount)
			.kind(TransactionKind.CHARGE)
			.status(txStatus)
			.subjectRef(optionalSubject(text(payload, "reference")))
			.authorRef(text(payload, "author_ref"))
			.payerRef(text(payload, "user_ref"))
			.revenueStream(RevenueStream.fromCode(text(payload, "revenue_stream")))
			.createdAt(now);
		if (txStatus == TransactionStatus.SETTLED) {
			builder.settledAt(now);
		} else {
			builder.failureCode(status.toLowerCase());
		}
		return Optional.of(builder.build());
	}

	private static Money parseMajorAmount(String value, CurrencyCode currency) {
		try {
			return Money.ofMajor(new BigDecimal(value.trim()), currency);
		} catch (NumberFormatException e) {
			throw new ValidationException("Malformed amount: " + value, e);
		}
	}
}
