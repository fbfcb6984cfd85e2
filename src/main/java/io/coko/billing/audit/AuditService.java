package io.coko.billing.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail for every money-relevant decision the engine takes.
 *
 * Event Types:
 * - JOB_EXECUTION: renewal run lifecycle
 * - INVOICE: invoice lifecycle (issued, paid, overdue, void)
 * - PAYMENT: ledger ingestion and charge attempts
 * - WEBHOOK: rejected or ignored provider notifications
 * - SUBSCRIPTION: subscription state changes
 * - ROYALTY: royalty computations, corrections and payouts
 * - CONFIG: configuration versions
 * - DLQ: Dead Letter Queue operations
 * - RECONCILIATION: reconciliation activities
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(JdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Log an audit event.
     * Non-blocking: failures are logged but don't throw exceptions.
     */
    public void logEvent(String eventType, String entityType, String entityId,
                         String action, String userId, Map<String, Object> details) {
        try {
            jdbc.update("""
                INSERT INTO billing_audit_log
                (audit_id, event_type, entity_type, entity_id, action, user_id, details, created_on)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                UUID.randomUUID(),
                eventType,
                entityType,
                entityId,
                action,
                userId != null ? userId : "system",
                serializeDetails(details),
                Timestamp.from(clock.instant())
            );
        } catch (DataAccessException e) {
            log.warn("Failed to log audit event (non-blocking): eventType={} entityId={} action={} error={}",
                eventType, entityId, action, e.getMessage());
            log.debug("Audit logging failure details", e);
        }
    }

    public List<Map<String, Object>> findByEntity(String entityType, String entityId) {
        return jdbc.queryForList("""
            SELECT audit_id, event_type, entity_type, entity_id, action, user_id, details, created_on
            FROM billing_audit_log
            WHERE entity_type = ? AND entity_id = ?
            ORDER BY created_on
            """,
            entityType, entityId
        );
    }

    private String serializeDetails(Map<String, Object> details) {
        if (details == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (Exception e) {
            log.warn("Failed to serialize audit details to JSON", e);
            return null;
        }
    }

    private static String idOf(UUID id) {
        return id != null ? id.toString() : null;
    }

    // ========================================================================
    // Convenience methods for common audit scenarios
    // ========================================================================

    public void logJobStarted(UUID billingRunId, String asOf, String triggeredBy) {
        Map<String, Object> details = new HashMap<>();
        details.put("asOf", asOf);
        logEvent("JOB_EXECUTION", "BILLING_RUN", idOf(billingRunId), "STARTED", triggeredBy, details);
    }

    public void logJobCompleted(UUID billingRunId, Map<String, Object> summary, String triggeredBy) {
        logEvent("JOB_EXECUTION", "BILLING_RUN", idOf(billingRunId), "COMPLETED", triggeredBy, summary);
    }

    public void logJobFailed(UUID billingRunId, String error, String triggeredBy) {
        Map<String, Object> details = new HashMap<>();
        details.put("error", error);
        logEvent("JOB_EXECUTION", "BILLING_RUN", idOf(billingRunId), "FAILED", triggeredBy, details);
    }

    public void logInvoiceEvent(UUID invoiceId, String action, Map<String, Object> details, String userId) {
        logEvent("INVOICE", "INVOICE", idOf(invoiceId), action, userId, details);
    }

    public void logPayment(UUID transactionId, String action, Map<String, Object> details) {
        logEvent("PAYMENT", "PAYMENT_TRANSACTION", idOf(transactionId), action, "system", details);
    }

    /**
     * Records a webhook that failed authentication. Nothing reaches the ledger for these,
     * so this row is the only trace of the attempt.
     */
    public void logWebhookRejected(String provider, String reason, int payloadBytes) {
        Map<String, Object> details = new HashMap<>();
        details.put("reason", reason);
        details.put("payloadBytes", payloadBytes);
        logEvent("WEBHOOK", "PROVIDER", provider, "REJECTED", "provider:" + provider, details);
    }

    public void logSubscriptionEvent(UUID subscriptionId, String action, Map<String, Object> details, String userId) {
        logEvent("SUBSCRIPTION", "SUBSCRIPTION", idOf(subscriptionId), action, userId, details);
    }

    public void logRoyaltyEvent(UUID royaltyId, String action, Map<String, Object> details, String userId) {
        logEvent("ROYALTY", "AUTHOR_ROYALTY", idOf(royaltyId), action, userId, details);
    }

    public void logConfigChange(UUID configId, Map<String, Object> details, String userId) {
        logEvent("CONFIG", "BILLING_CONFIGURATION", idOf(configId), "VERSION_ADDED", userId, details);
    }

    public void logDLQCreated(UUID dlqId, String sourceType, String sourceId, String errorType, String errorMessage) {
        Map<String, Object> details = new HashMap<>();
        details.put("sourceType", sourceType);
        details.put("sourceId", sourceId);
        details.put("errorType", errorType);
        details.put("errorMessage", errorMessage);
        logEvent("DLQ", "DLQ", idOf(dlqId), "DLQ_CREATED", "system", details);
    }

    public void logDLQResolved(UUID dlqId, String resolvedBy, String resolutionNotes) {
        Map<String, Object> details = new HashMap<>();
        details.put("resolvedBy", resolvedBy);
        details.put("resolutionNotes", resolutionNotes);
        logEvent("DLQ", "DLQ", idOf(dlqId), "DLQ_RESOLVED", resolvedBy, details);
    }

    public void logDLQRequeued(UUID dlqId, String sourceId, String userId) {
        Map<String, Object> details = new HashMap<>();
        details.put("sourceId", sourceId);
        logEvent("DLQ", "DLQ", idOf(dlqId), "DLQ_REQUEUED", userId, details);
    }

    public void logReconciliationStarted(UUID reconciliationId, String period, String userId) {
        Map<String, Object> details = new HashMap<>();
        details.put("period", period);
        logEvent("RECONCILIATION", "RECONCILIATION", idOf(reconciliationId), "RECONCILIATION_STARTED", userId, details);
    }

    public void logReconciliationCompleted(UUID reconciliationId, Map<String, Object> results, String userId) {
        logEvent("RECONCILIATION", "RECONCILIATION", idOf(reconciliationId), "RECONCILIATION_COMPLETED", userId, results);
    }
}
