package io.coko.billing.reconciliation;

import io.coko.billing.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Daily reconciliation of the ledger against invoices.
 * Every report run is audited.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private static final int LIST_LIMIT = 100;

    private final JdbcTemplate jdbc;
    private final AuditService auditService;
    private final Clock clock;

    public ReconciliationService(JdbcTemplate jdbc, AuditService auditService, Clock clock) {
        this.jdbc = jdbc;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Report for one UTC day: ledger movements by provider, kind, status and currency, failed charges,
     * invoices paid that day whose ledger total falls short, and payments flagged on void invoices.
     */
    public Map<String, Object> generateDailyReconciliation(LocalDate date, String userId) {
        UUID reconciliationId = UUID.randomUUID();
        auditService.logReconciliationStarted(reconciliationId, "DAILY:" + date, userId);

        Timestamp from = Timestamp.from(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        Timestamp to = Timestamp.from(date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("reconciliationId", reconciliationId.toString());
        report.put("date", date.toString());
        report.put("generatedAt", clock.instant().toString());
        report.put("type", "DAILY");

        List<Map<String, Object>> ledgerSummary = jdbc.queryForList("""
            SELECT provider, kind, status, currency, COUNT(1) AS tx_count, COALESCE(SUM(amount_minor), 0) AS total_minor
            FROM payment_transaction
            WHERE created_at >= ? AND created_at < ?
            GROUP BY provider, kind, status, currency
            ORDER BY provider, kind, status, currency
            """,
            from, to
        );
        report.put("ledgerSummary", ledgerSummary);

        List<Map<String, Object>> failedCharges = jdbc.queryForList("""
            SELECT id, provider, provider_transaction_id, amount_minor, currency, failure_code, subject_type, subject_id
            FROM payment_transaction
            WHERE kind = 'CHARGE' AND status = 'FAILED' AND created_at >= ? AND created_at < ?
            ORDER BY created_at DESC
            LIMIT ?
            """,
            from, to, LIST_LIMIT
        );
        report.put("failedCharges", failedCharges);

        List<Map<String, Object>> variances = jdbc.queryForList("""
            SELECT i.id AS invoice_id, i.invoice_number, i.currency, i.total_minor,
                   COALESCE(SUM(CASE
                       WHEN t.kind IN ('CHARGE', 'PAYOUT') AND t.status = 'SETTLED' THEN t.amount_minor
                       WHEN t.kind = 'REFUND' AND t.status IN ('SETTLED', 'REVERSED') THEN -t.amount_minor
                       ELSE 0 END), 0) AS applied_minor
            FROM invoice i
            LEFT JOIN payment_transaction t
              ON t.currency = i.currency
             AND ((t.subject_type = 'INVOICE' AND t.subject_id = i.id) OR t.id = i.source_transaction_id)
            WHERE i.status = 'PAID' AND i.paid_at >= ? AND i.paid_at < ?
            GROUP BY i.id, i.invoice_number, i.currency, i.total_minor
            HAVING COALESCE(SUM(CASE
                       WHEN t.kind IN ('CHARGE', 'PAYOUT') AND t.status = 'SETTLED' THEN t.amount_minor
                       WHEN t.kind = 'REFUND' AND t.status IN ('SETTLED', 'REVERSED') THEN -t.amount_minor
                       ELSE 0 END), 0) < i.total_minor
            ORDER BY i.invoice_number
            """,
            from, to
        );
        report.put("paidInvoiceVariances", variances);

        List<Map<String, Object>> flagged = jdbc.queryForList("""
            SELECT entity_type, entity_id, action, details, created_on
            FROM billing_audit_log
            WHERE action IN ('PAYMENT_FLAGGED', 'UNMATCHED') AND created_on >= ? AND created_on < ?
            ORDER BY created_on DESC
            LIMIT ?
            """,
            from, to, LIST_LIMIT
        );
        report.put("flaggedPayments", flagged);

        long settled = 0;
        long failed = 0;
        for (Map<String, Object> row : ledgerSummary) {
            if ("CHARGE".equals(row.get("kind"))) {
                long count = ((Number) row.get("tx_count")).longValue();
                if ("SETTLED".equals(row.get("status"))) {
                    settled += count;
                } else if ("FAILED".equals(row.get("status"))) {
                    failed += count;
                }
            }
        }
        double successRate = settled + failed > 0 ? (double) settled / (settled + failed) * 100 : 0;
        report.put("metrics", Map.of(
            "settledCharges", settled,
            "failedCharges", failed,
            "chargeSuccessRate", String.format("%.2f%%", successRate),
            "varianceCount", variances.size()
        ));

        log.info("Generated daily reconciliation report: reconciliationId={} date={} settled={} failed={} variances={} userId={}",
            reconciliationId, date, settled, failed, variances.size(), userId);

        Map<String, Object> auditDetails = new HashMap<>();
        auditDetails.put("date", date.toString());
        auditDetails.put("settledCharges", settled);
        auditDetails.put("failedCharges", failed);
        auditDetails.put("varianceCount", variances.size());
        auditService.logReconciliationCompleted(reconciliationId, auditDetails, userId);
        return report;
    }
}
