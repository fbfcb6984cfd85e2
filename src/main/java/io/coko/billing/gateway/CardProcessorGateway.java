package io.coko.billing.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
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
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * International card processor.
 *
 * Webhooks are signed with HMAC-SHA256 over {@code "<timestamp>.<body>"}; the header has the form
 * {@code t=<epoch seconds>,v1=<hex digest>}. Amounts are in minor units and currencies lower-case.
 */
@Component
public class CardProcessorGateway extends AbstractHttpPaymentGateway {

	public static final String SIGNATURE_HEADER = "Card-Signature";

	private final BillingEngineProperties.Card settings;

	public CardProcessorGateway(BillingEngineProperties props, ObjectMapper objectMapper, BillingMetrics metrics,
			Clock clock) {
		super(props.getProviders().getCard().getTimeoutMs(), objectMapper, metrics, clock);
		this.settings = props.getProviders().getCard();
	}

	@Override
	public PaymentProvider provider() {
		return PaymentProvider.CARD;
	}

	@Override
	public String signatureHeaderName() {
		return SIGNATURE_HEADER;
	}

	@Override
	@CircuitBreaker(name = "card", fallbackMethod = "circuitOpen")
	public ChargeResult initiateCharge(ChargeRequest request) {
		HttpHeaders headers = new HttpHeaders();
		headers.setBearerAuth(settings.getApiKey());
		headers.set("Idempotency-Key", request.getIdempotencyKey());

		Map<String, Object> metadata = new HashMap<>();
		metadata.put("reference", request.getSubjectRef().toString());
		metadata.put("attempt_id", request.getIdempotencyKey());
		Map<String, Object> body = new HashMap<>();
		body.put("amount", request.getAmount().getAmountMinorUnits());
		body.put("currency", request.getAmount().getCurrency().getCode().toLowerCase());
		body.put("payment_method", request.getPaymentMethodRef());
		body.put("customer", request.getUserRef());
		body.put("description", request.getDescription());
		body.put("metadata", metadata);

		ProviderResponse response = postJson("charge", settings.getBaseUrl() + settings.getChargePath(), headers, body);
		Map<String, Object> resp = response.getBody();

		if (response.getStatusCode() == 402) {
			String code = declineCode(resp);
			log.info("Card charge declined: attemptId={} code={}", request.getAttemptId(), code);
			return ChargeResult.failed(chargeIdFromError(resp), code);
		}
		if (!response.isSuccessful()) {
			String code = declineCode(resp);
			throw ProviderException.permanentFailure(provider(), code,
				"Card charge rejected with status " + response.getStatusCode());
		}

		String chargeId = bodyText(resp, "id");
		String status = String.valueOf(resp.getOrDefault("status", "unknown"));
		switch (status.toLowerCase()) {
			case "succeeded":
				return ChargeResult.settled(chargeId);
			case "pending":
			case "processing":
				return ChargeResult.pending(chargeId);
			case "failed":
				return ChargeResult.failed(chargeId, Optional.ofNullable(bodyText(resp, "failure_code")).orElse("card_failed"));
			default:
				throw ProviderException.permanentFailure(provider(), "unsupported_status",
					"Card charge returned unsupported status " + status);
		}
	}

	/**
	 * Open circuit: the call was never sent, so it is safe to try again later.
	 */
	public ChargeResult circuitOpen(ChargeRequest request, CallNotPermittedException e) {
		throw ProviderException.transientFailure(provider(), "Card circuit breaker open", e);
	}

	private String declineCode(Map<String, Object> body) {
		JsonNode error = errorNode(body);
		String code = Optional.ofNullable(text(error, "decline_code")).orElse(text(error, "code"));
		return code != null ? code : "card_declined";
	}

	private String chargeIdFromError(Map<String, Object> body) {
		return text(errorNode(body), "charge");
	}

	private JsonNode errorNode(Map<String, Object> body) {
		if (body == null) {
			return MissingNode.getInstance();
		}
		JsonNode tree = objectMapper.valueToTree(body);
		return tree.path("error");
	}

	@Override
	public void verifyWebhookSignature(byte[] rawPayload, String signatureHeader) {
		if (settings.getWebhookSecret() == null || settings.getWebhookSecret().isBlank()) {
			throw new UnauthenticatedWebhookException(provider(), "No webhook secret configured");
		}
		if (signatureHeader == null || signatureHeader.isBlank()) {
			throw new UnauthenticatedWebhookException(provider(), "Missing signature header");
		}
		String timestamp = null;
		List<String> signatures = new ArrayList<>();
		for (String part : signatureHeader.split(",")) {
			String[] kv = part.trim().split("=", 2);
			if (kv.length != 2) {
				continue;
			}
			if ("t".equals(kv[0])) {
				timestamp = kv[1];
			} else if ("v1".equals(kv[0])) {
				signatures.add(kv[1]);
			}
		}
		if (timestamp == null || signatures.isEmpty()) {
			throw new UnauthenticatedWebhookException(provider(), "Malformed signature header");
		}
		long epochSeconds;
		try {
			epochSeconds = Long.parseLong(timestamp);
		} catch (NumberFormatException e) {
			throw new UnauthenticatedWebhookException(provider(), "Malformed signature timestamp", e);
		}
		long skew = Math.abs(clock.instant().getEpochSecond() - epochSeconds);
		if (skew > settings.getSignatureToleranceSeconds()) {
			throw new UnauthenticatedWebhookException(provider(), "Signature timestamp outside tolerance");
		}

		String expected = sign(timestamp, rawPayload);
		byte[] expectedBytes = expected.getBytes(StandardCharsets.US_ASCII);
		for (String candidate : signatures) {
			if (MessageDigest.isEqual(expectedBytes, candidate.toLowerCase().getBytes(StandardCharsets.US_ASCII))) {
				return;
			}
		}
		throw new UnauthenticatedWebhookException(provider(), "Signature mismatch");
	}

	/**
	 * Hex HMAC-SHA256 of {@code "<timestamp>.<body>"} with the webhook secret.
	 */
	public String sign(String timestamp, byte[] rawPayload) {
		byte[] prefix = (timestamp + ".").getBytes(StandardCharsets.UTF_8);
		byte[] message = new byte[prefix.length + rawPayload.length];
		System.arraycopy(prefix, 0, message, 0, prefix.length);
		System.arraycopy(rawPayload, 0, message, prefix.length, rawPayload.length);
		return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, settings.getWebhookSecret()).hmacHex(message);
	}

	@Override
	public Optional<PaymentTransaction> normalizeWebhookPayload(byte[] rawPayload) {
		JsonNode event = readPayload(rawPayload);
		String type = requireText(event, "type");
		JsonNode data = event.path("data").path("object");
		if (!data.isObject()) {
			throw new ValidationException("Card event has no data.object", "data.object", null);
		}

		switch (type) {
			case "charge.succeeded":
				return Optional.of(transaction(data, TransactionKind.CHARGE, TransactionStatus.SETTLED)
					.build());
			case "charge.failed":
				return Optional.of(transaction(data, TransactionKind.CHARGE, TransactionStatus.FAILED)
					.failureCode(Optional.ofNullable(text(data, "failure_code")).orElse("card_failed"))
					.settledAt(null)
					.build());
			case "charge.refunded":
				return Optional.of(transaction(data, TransactionKind.REFUND, TransactionStatus.SETTLED)
					.relatedProviderTransactionId(text(data, "charge"))
					.build());
			case "charge.dispute.lost":
				return Optional.of(transaction(data, TransactionKind.REFUND, TransactionStatus.REVERSED)
					.relatedProviderTransactionId(text(data, "charge"))
					.failureCode("chargeback")
					.build());
			default:
				log.debug("Card event carries no money movement: type={}", type);
				return Optional.empty();
		}
	}

	private PaymentTransaction.Builder transaction(JsonNode data, TransactionKind kind, TransactionStatus status) {
		CurrencyCode currency = requireCurrency(data, "currency");
		JsonNode amountNode = data.get("amount");
		if (amountNode == null || !amountNode.isIntegralNumber() || !amountNode.canConvertToLong()) {
			throw new ValidationException("Card event amount must be an integer in minor units", "amount", amountNode);
		}
		long amount = amountNode.asLong();
		if (amount < 0) {
			throw new ValidationException("Card event amount must not be negative", "amount", amount);
		}
		JsonNode metadata = data.path("metadata");
		Instant now = clock.instant();
		Instant occurredAt = data.hasNonNull("created") ? Instant.ofEpochSecond(data.get("created").asLong()) : now;

		return PaymentTransaction.builder()
			.externalRef(provider(), requireText(data, "id"))
			.amount(Money.ofMinor(amount, currency))
			.kind(kind)
			.status(status)
			.subjectRef(optionalSubject(text(metadata, "reference")))
			.authorRef(text(metadata, "author_ref"))
			.payerRef(Optional.ofNullable(text(metadata, "user_ref")).orElse(text(data, "customer")))
			.revenueStream(RevenueStream.fromCode(text(metadata, "revenue_stream")))
			.createdAt(now)
			.settledAt(occurredAt);
	}
}
