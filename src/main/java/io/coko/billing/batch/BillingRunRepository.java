package io.coko.billing.batch;

import io.coko.billing.batch.model.BillingRunStatus;
import io.coko.billing.batch.model.RenewalWorkItem;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class BillingRunRepository {

  private final JdbcTemplate jdbc;

  public BillingRunRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public UUID createRun(Instant asOf, String triggeredBy, String correlationId, Instant now) {
    UUID id = UUID.randomUUID();
    jdbc.update(
      "INSERT INTO billing_run (billing_run_id, as_of, triggered_by, correlation_id, status, started_on) " +
      "VALUES (?, ?, ?, ?, ?, ?)",
      id, Timestamp.from(asOf), triggeredBy, correlationId, BillingRunStatus.RUNNING.getCode(), Timestamp.from(now)
    );
    return id;
  }

  public void completeRun(UUID runId, BillingRunStatus status, String summaryJson, Instant now) {
    jdbc.update(
      "UPDATE billing_run SET ended_on = ?, status = ?, summary_json = ? WHERE billing_run_id = ?",
      Timestamp.from(now), status.getCode(), summaryJson, runId
    );
  }

  /**
   * Close a run that is still RUNNING, e.g. after the job itself failed.
   */
  public int failRunIfRunning(UUID runId, String error, Instant now) {
    return jdbc.update(
      "UPDATE billing_run SET ended_on = ?, status = ?, summary_json = ? WHERE billing_run_id = ? AND status = ?",
      Timestamp.from(now), BillingRunStatus.FAILED.getCode(), error, runId, BillingRunStatus.RUNNING.getCode()
    );
  }

  public void insertItem(RenewalWorkItem item) {
    jdbc.update(
      "INSERT INTO billing_run_item (billing_run_item_id, billing_run_id, subscription_id, result, failure_reason, processed_on) " +
      "VALUES (?, ?, ?, ?, ?, ?)",
      UUID.randomUUID(), item.getBillingRunId(), item.getSubscriptionId(), item.getResult(),
      item.getFailureReason(), Timestamp.from(item.getProcessedAt())
    );
  }

  public Optional<Map<String, Object>> findRun(UUID runId) {
    List<Map<String, Object>> rows = jdbc.queryForList(
      "SELECT billing_run_id, as_of, triggered_by, correlation_id, status, started_on, ended_on, summary_json " +
      "FROM billing_run WHERE billing_run_id = ?",
      runId
    );
    return rows.stream().findFirst();
  }

  public List<Map<String, Object>> countsByResult(UUID runId) {
    return jdbc.queryForList(
      "SELECT result, COUNT(1) AS cnt FROM billing_run_item WHERE billing_run_id = ? GROUP BY result ORDER BY result",
      runId
    );
  }

  public List<Map<String, Object>> items(UUID runId, int limit) {
    return jdbc.queryForList(
      "SELECT billing_run_item_id, subscription_id, result, failure_reason, processed_on " +
      "FROM billing_run_item WHERE billing_run_id = ? ORDER BY processed_on DESC LIMIT ?",
      runId, limit
    );
  }

  public List<Map<String, Object>> recentRuns(int limit) {
    return jdbc.queryForList(
      "SELECT billing_run_id, as_of, triggered_by, status, started_on, ended_on " +
      "FROM billing_run ORDER BY started_on DESC LIMIT ?",
      limit
    );
  }
}
