package io.coko.billing.dlq;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.coko.billing.audit.AuditService;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.task.BillingTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for managing Dead Letter Queue (DLQ) entries.
 * Stores billing work that failed permanently (exhausted tasks, renewal items the batch
 * job had to skip) for manual review and recovery.
 */
@Service
public class DeadLetterQueueService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueService.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final AuditService auditService;
    private final BillingTaskQueue taskQueue;
    private final Clock clock;

    public DeadLetterQueueService(JdbcTemplate jdbc, ObjectMapper objectMapper, AuditService auditService,
                                  BillingTaskQueue taskQueue, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.auditService = auditService;
        this.taskQueue = taskQueue;
        this.clock = clock;
    }

    /**
     * Add failed work to the Dead Letter Queue. Never throws: a DLQ failure is logged at error level.
     * @param sourceType TASK or RENEWAL
     */
    public void addToDLQ(String sourceType, String sourceId, Object payload, Throwable error, String errorType) {
        UUID dlqId = UUID.randomUUID();
        try {
            String payloadJson = objectMapper.writeValueAsString(payload);
            String errorMessage = error != null ? error.getMessage() : "Unknown error";

            jdbc.update("""
                INSERT INTO billing_dead_letter_queue
                (dlq_id, source_type, source_id, error_type, error_message, error_stack_trace,
                 payload_json, retry_count, resolved, created_on)
                VALUES (?, ?, ?, ?, ?, ?, ?, 0, false, ?)
                """,
                dlqId,
                sourceType,
                sourceId,
                errorType != null ? errorType : "UNKNOWN",
                errorMessage,
                getStackTrace(error),
                payloadJson,
                Timestamp.from(clock.instant())
            );

            log.warn("Added to DLQ: dlqId={} sourceType={} sourceId={} errorType={} error={}",
                dlqId, sourceType, sourceId, errorType, errorMessage);
            auditService.logDLQCreated(dlqId, sourceType, sourceId, errorType, errorMessage);
        } catch (Exception e) {
            log.error("Failed to add to DLQ: sourceType={} sourceId={}", sourceType, sourceId, e);
        }
    }

    public List<Map<String, Object>> getUnresolvedEntries() {
        return jdbc.queryForList("""
            SELECT dlq_id, source_type, source_id, error_type, error_message, created_on,
                   retry_count, last_retry_on
            FROM billing_dead_letter_queue
            WHERE resolved = false
            ORDER BY created_on DESC
            """
        );
    }

    public int getUnresolvedCount() {
        try {
            Integer count = jdbc.queryForObject(
                "SELECT COUNT(1) FROM billing_dead_letter_queue WHERE resolved = false",
                Integer.class
            );
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            log.error("Failed to get DLQ count", e);
            return 0;
        }
    }

    public void markResolved(UUID dlqId, String resolvedBy, String resolutionNotes) {
        int updated = jdbc.update("""
            UPDATE billing_dead_letter_queue
            SET resolved = true, resolved_on = ?, resolved_by = ?, resolution_notes = ?
            WHERE dlq_id = ?
            """,
            Timestamp.from(clock.instant()),
            resolvedBy,
            resolutionNotes,
            dlqId
        );
        if (updated == 0) {
            throw new NotFoundException("DLQ entry", dlqId);
        }
        log.info("Marked DLQ entry as resolved: dlqId={} resolvedBy={}", dlqId, resolvedBy);
        auditService.logDLQResolved(dlqId, resolvedBy, resolutionNotes);
    }

    /**
     * Put the task behind a TASK entry back in the queue. The entry stays open until it is resolved.
     */
    public void requeue(UUID dlqId, String userId) {
        List<Map<String, Object>> rows = jdbc.queryForList(
            "SELECT source_type, source_id FROM billing_dead_letter_queue WHERE dlq_id = ?", dlqId);
        if (rows.isEmpty()) {
            throw new NotFoundException("DLQ entry", dlqId);
        }
        String sourceType = String.valueOf(rows.get(0).get("source_type"));
        String sourceId = String.valueOf(rows.get(0).get("source_id"));
        if (!"TASK".equals(sourceType)) {
            throw new ValidationException("Only TASK entries can be requeued", "sourceType", sourceType);
        }
        if (!taskQueue.requeue(UUID.fromString(sourceId), clock.instant())) {
            throw new ValidationException("Task " + sourceId + " is not dead", "sourceId", sourceId);
        }
        incrementRetryCount(dlqId);
        log.info("Requeued DLQ task: dlqId={} taskId={} userId={}", dlqId, sourceId, userId);
        auditService.logDLQRequeued(dlqId, sourceId, userId);
    }

    public void incrementRetryCount(UUID dlqId) {
        jdbc.update("""
            UPDATE billing_dead_letter_queue
            SET retry_count = retry_count + 1, last_retry_on = ?
            WHERE dlq_id = ?
            """,
            Timestamp.from(clock.instant()),
            dlqId
        );
    }

    private String getStackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        error.printStackTrace(pw);
        return sw.toString();
    }
}
