package io.coko.billing.health;

import io.coko.billing.dlq.DeadLetterQueueService;
import io.coko.billing.task.BillingTaskQueue;
import io.coko.billing.task.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the billing engine: database connectivity, DLQ size and the background task backlog.
 */
@Component("billing")
public class BillingHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(BillingHealthIndicator.class);

    static final int DLQ_THRESHOLD = 100;
    static final int DEAD_TASK_THRESHOLD = 0;

    private final JdbcTemplate jdbc;
    private final DeadLetterQueueService dlqService;
    private final BillingTaskQueue taskQueue;

    public BillingHealthIndicator(JdbcTemplate jdbc, DeadLetterQueueService dlqService, BillingTaskQueue taskQueue) {
        this.jdbc = jdbc;
        this.dlqService = dlqService;
        this.taskQueue = taskQueue;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        Map<String, Object> details = new HashMap<>();

        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", Map.of("status", "UP", "message", "Connected"));
        } catch (DataAccessException e) {
            log.warn("Billing health check: database unreachable error={}", e.getMessage());
            return builder.down().withDetail("database", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage()))).build();
        }

        boolean healthy = true;
        int dlqSize = dlqService.getUnresolvedCount();
        details.put("deadLetterQueue", Map.of("size", dlqSize, "status", dlqSize > DLQ_THRESHOLD ? "WARNING" : "OK"));
        if (dlqSize > DLQ_THRESHOLD) {
            builder.withDetail("dlqWarning", "DLQ size exceeds threshold: " + dlqSize);
            healthy = false;
        }

        try {
            Map<String, Integer> tasks = taskQueue.countByStatus();
            details.put("tasks", tasks);
            int dead = tasks.getOrDefault(TaskStatus.DEAD.getCode(), 0);
            if (dead > DEAD_TASK_THRESHOLD) {
                builder.withDetail("taskWarning", "Dead background tasks: " + dead);
            }
        } catch (DataAccessException e) {
            details.put("tasks", Map.of("status", "CHECK_FAILED", "error", String.valueOf(e.getMessage())));
        }

        try {
            Integer activeRuns = jdbc.queryForObject("SELECT COUNT(1) FROM billing_run WHERE status = 'RUNNING'", Integer.class);
            details.put("activeRuns", activeRuns != null ? activeRuns : 0);
        } catch (DataAccessException e) {
            details.put("activeRuns", "CHECK_FAILED");
        }

        builder.withDetails(details);
        return healthy ? builder.up().build() : builder.status(Status.DOWN).build();
    }
}
