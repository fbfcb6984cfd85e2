package io.coko.billing.gateway;

import io.coko.billing.audit.AuditService;
import io.coko.billing.exception.UnauthenticatedWebhookException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.metrics.BillingMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Verifies, normalizes and records provider notifications.
 * Authenticity is checked before the payload is parsed; nothing reaches the ledger otherwise.
 */
@Service
public class WebhookIngestionService {

	private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

	private final PaymentGatewayRegistry gatewayRegistry;
	private final PaymentIngestionService paymentIngestion;
	private final AuditService auditService;
	private final BillingMetrics metrics;

	public WebhookIngestionService(PaymentGatewayRegistry gatewayRegistry, PaymentIngestionService paymentIngestion,
			AuditService auditService, BillingMetrics metrics) {
		this.gatewayRegistry = gatewayRegistry;
		this.paymentIngestion = paymentIngestion;
		this.auditService = auditService;
		this.metrics = metrics;
	}

	public IngestResult ingest(PaymentProvider provider, byte[] rawPayload, String signatureHeader) {
		Timer.Sample sample = metrics.startTimer();
		int payloadBytes = rawPayload != null ? rawPayload.length : 0;
		try {
			PaymentGateway gateway = gatewayRegistry.get(provider);
			try {
				gateway.verifyWebhookSignature(rawPayload != null ? rawPayload : new byte[0], signatureHeader);
			} catch (UnauthenticatedWebhookException e) {
				log.warn("Webhook rejected: provider={} reason={} bytes={}", provider, e.getMessage(), payloadBytes);
				auditService.logWebhookRejected(provider.getCode(), e.getMessage(), payloadBytes);
				metrics.recordWebhook(provider.getCode(), "unauthenticated");
				throw e;
			}

			Optional<PaymentTransaction> normalized;
			try {
				normalized = gateway.normalizeWebhookPayload(rawPayload);
			} catch (ValidationException e) {
				log.warn("Webhook payload malformed: provider={} reason={}", provider, e.getMessage());
				auditService.logWebhookRejected(provider.getCode(), "malformed: " + e.getMessage(), payloadBytes);
				metrics.recordWebhook(provider.getCode(), "malformed");
				throw e;
			}

			if (normalized.isEmpty()) {
				metrics.recordWebhook(provider.getCode(), IngestResult.Outcome.IGNORED.getCode());
				return IngestResult.ignored();
			}
			PaymentTransaction tx = normalized.get();
			if (tx.getProvider() != provider) {
				throw new ValidationException("Normalized transaction belongs to " + tx.getProvider()
					+ ", not " + provider, "provider", tx.getProvider());
			}

			IngestResult result = paymentIngestion.ingest(tx);
			log.info("Webhook ingested: provider={} ref={} kind={} status={} result={}",
				provider, tx.getProviderTransactionId(), tx.getKind(), tx.getStatus(), result.getOutcome().getCode());
			metrics.recordWebhook(provider.getCode(), result.getOutcome().getCode());
			return result;
		} finally {
			metrics.recordWebhookIngestionTime(sample);
		}
	}
}
