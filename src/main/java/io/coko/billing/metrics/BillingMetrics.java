package io.coko.billing.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Metrics collection for the billing engine.
 * Provides Prometheus-compatible metrics for monitoring and alerting.
 */
@Component
public class BillingMetrics {

    private static final Logger log = LoggerFactory.getLogger(BillingMetrics.class);

    private final MeterRegistry registry;
    private final Counter invoicesIssued;
    private final Counter invoicesPaid;
    private final Counter invoicesOverdue;
    private final Counter invoicesVoided;
    private final Timer renewalJobTime;
    private final Timer webhookIngestionTime;

    public BillingMetrics(MeterRegistry registry, JdbcTemplate jdbc) {
        this.registry = registry;

        this.invoicesIssued = Counter.builder("billing.invoices.issued")
            .description("Invoices issued")
            .register(registry);

        this.invoicesPaid = Counter.builder("billing.invoices.paid")
            .description("Invoices transitioned to PAID")
            .register(registry);

        this.invoicesOverdue = Counter.builder("billing.invoices.overdue")
            .description("Invoices flagged OVERDUE")
            .register(registry);

        this.invoicesVoided = Counter.builder("billing.invoices.voided")
            .description("Invoices voided")
            .register(registry);

        this.renewalJobTime = Timer.builder("billing.renewal.job.execution.time")
            .description("Total renewal job execution time")
            .register(registry);

        this.webhookIngestionTime = Timer.builder("billing.webhook.ingestion.time")
            .description("Time to verify, normalize and record a provider webhook")
            .register(registry);

        Gauge.builder("billing.dlq.size", () -> count(jdbc,
                "SELECT COUNT(1) FROM billing_dead_letter_queue WHERE resolved = false"))
            .description("Current size of dead letter queue")
            .register(registry);

        Gauge.builder("billing.tasks.pending", () -> count(jdbc,
                "SELECT COUNT(1) FROM billing_task WHERE status IN ('PENDING', 'RUNNING')"))
            .description("Billing tasks waiting to be processed")
            .register(registry);
    }

    public void recordLedgerIngest(String provider, String outcome) {
        Counter.builder("billing.ledger.ingested")
            .tag("provider", provider)
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }

    public void recordWebhook(String provider, String result) {
        Counter.builder("billing.webhooks.received")
            .tag("provider", provider)
            .tag("result", result)
            .register(registry)
            .increment();
    }

    public void recordChargeResult(String provider, String result) {
        Counter.builder("billing.charges")
            .tag("provider", provider)
            .tag("result", result != null ? result : "unknown")
            .register(registry)
            .increment();
    }

    public void recordProviderCall(String provider, Timer.Sample sample) {
        sample.stop(Timer.builder("billing.provider.call.time")
            .tag("provider", provider)
            .register(registry));
    }

    public void recordSubscriptionTransition(String toStatus) {
        Counter.builder("billing.subscriptions.transitions")
            .tag("status", toStatus)
            .register(registry)
            .increment();
    }

    public void recordRoyaltiesComputed(int records) {
        Counter.builder("billing.royalties.records")
            .register(registry)
            .increment(records);
    }

    public void recordRenewalSkipped(long skipped) {
        Counter.builder("billing.renewal.skipped")
            .register(registry)
            .increment(skipped);
    }

    public void recordTask(String taskType, String outcome) {
        Counter.builder("billing.tasks.processed")
            .tag("type", taskType)
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }

    public void recordInvoiceIssued() {
        invoicesIssued.increment();
    }

    public void recordInvoicePaid() {
        invoicesPaid.increment();
    }

    public void recordInvoiceOverdue() {
        invoicesOverdue.increment();
    }

    public void recordInvoiceVoided() {
        invoicesVoided.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordRenewalJobTime(Timer.Sample sample) {
        sample.stop(renewalJobTime);
    }

    public void recordWebhookIngestionTime(Timer.Sample sample) {
        sample.stop(webhookIngestionTime);
    }

    private static int count(JdbcTemplate jdbc, String sql) {
        try {
            Integer count = jdbc.queryForObject(sql, Integer.class);
            return count != null ? count : 0;
        } catch (Exception e) {
            log.debug("Failed to evaluate gauge query: {}", sql, e);
            return 0;
        }
    }
}
