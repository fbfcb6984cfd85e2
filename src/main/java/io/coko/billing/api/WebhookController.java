package io.coko.billing.api;

import io.coko.billing.gateway.IngestResult;
import io.coko.billing.gateway.PaymentGatewayRegistry;
import io.coko.billing.gateway.WebhookIngestionService;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ratelimit.BillingRateLimiter;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Provider notification endpoint. The raw body is handed to the gateway untouched so the signature
 * can be checked over the exact bytes the provider sent.
 */
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

	private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

	private final WebhookIngestionService ingestionService;
	private final PaymentGatewayRegistry gatewayRegistry;
	private final BillingRateLimiter rateLimiter;

	public WebhookController(WebhookIngestionService ingestionService, PaymentGatewayRegistry gatewayRegistry,
			BillingRateLimiter rateLimiter) {
		this.ingestionService = ingestionService;
		this.gatewayRegistry = gatewayRegistry;
		this.rateLimiter = rateLimiter;
	}

	// POST /api/webhooks/card
	// POST /api/webhooks/orange_money
	// POST /api/webhooks/mtn_momo
	@PostMapping("/{provider}")
	public ResponseEntity<Map<String, Object>> receive(@PathVariable("provider") String providerCode,
			@RequestHeader HttpHeaders headers,
			@RequestBody(required = false) byte[] body) {

		PaymentProvider provider = PaymentProvider.fromCode(providerCode);
		if (provider == null) {
			log.warn("Webhook for unknown provider: provider={}", providerCode);
			return ResponseEntity.notFound().build();
		}

		if (!rateLimiter.tryConsumeWebhook(provider)) {
			return ResponseEntity.status(429).body(Map.of(
				"error", "rate_limited",
				"provider", provider.getCode()
			));
		}

		String correlationId = LoggingUtils.generateCorrelationId();
		LoggingUtils.setCorrelationId(correlationId);
		LoggingUtils.setProvider(provider.getCode());
		try {
			String signature = headers.getFirst(gatewayRegistry.get(provider).signatureHeaderName());
			IngestResult result = ingestionService.ingest(provider, body, signature);

			Map<String, Object> response = new HashMap<>();
			response.put("result", result.getOutcome().getCode());
			if (result.getTransactionId() != null) {
				response.put("transactionId", result.getTransactionId().toString());
			}
			return ResponseEntity.ok(response);
		} finally {
			LoggingUtils.clearContext();
		}
	}
}
