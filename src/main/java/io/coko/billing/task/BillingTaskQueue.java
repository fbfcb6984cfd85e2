package io.coko.billing.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable task queue backed by the billing_task table.
 *
 * Workers claim a task with a conditional update that sets a lease; a task whose lease
 * expired (worker crashed) becomes claimable again. Delivery is therefore at-least-once
 * and any number of workers can drain the queue concurrently without a global lock.
 */
@Component
public class BillingTaskQueue {

	private static final Logger log = LoggerFactory.getLogger(BillingTaskQueue.class);
	private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

	private final JdbcTemplate jdbc;
	private final ObjectMapper objectMapper;

	public BillingTaskQueue(JdbcTemplate jdbc, ObjectMapper objectMapper) {
		this.jdbc = jdbc;
		this.objectMapper = objectMapper;
	}

	/**
	 * Enqueue a task in the caller's transaction.
	 * @throws DuplicateKeyException if a task with the same dedupe key exists
	 */
	public UUID enqueue(TaskType type, Map<String, Object> payload, String dedupeKey, Instant now) {
		UUID taskId = UUID.randomUUID();
		jdbc.update("""
			INSERT INTO billing_task
			(task_id, task_type, payload_json, dedupe_key, status, attempts, available_at, created_at, updated_at)
			VALUES (?, ?, ?, ?, ?, 0, ?, ?, ?)
			""",
			taskId,
			type.getCode(),
			writePayload(payload),
			dedupeKey,
			TaskStatus.PENDING.getCode(),
			Timestamp.from(now),
			Timestamp.from(now),
			Timestamp.from(now)
		);
		log.debug("Enqueued task: taskId={} type={} dedupeKey={}", taskId, type, dedupeKey);
		return taskId;
	}

	/**
	 * Enqueue unless a task with the same dedupe key was already enqueued.
	 * Must be called outside a surrounding transaction.
	 */
	public Optional<UUID> enqueueIfAbsent(TaskType type, Map<String, Object> payload, String dedupeKey, Instant now) {
		try {
			return Optional.of(enqueue(type, payload, dedupeKey, now));
		} catch (DuplicateKeyException e) {
			log.info("Task already enqueued, skipping: type={} dedupeKey={}", type, dedupeKey);
			return Optional.empty();
		}
	}

	public Optional<BillingTask> findById(UUID taskId) {
		List<BillingTask> tasks = jdbc.query("""
			SELECT task_id, task_type, payload_json, dedupe_key, status, attempts, available_at,
			       lease_until, last_error, created_at
			FROM billing_task WHERE task_id = ?
			""",
			rowMapper(), taskId);
		return tasks.stream().findFirst();
	}

	public Optional<BillingTask> findByDedupeKey(String dedupeKey) {
		List<BillingTask> tasks = jdbc.query("""
			SELECT task_id, task_type, payload_json, dedupe_key, status, attempts, available_at,
			       lease_until, last_error, created_at
			FROM billing_task WHERE dedupe_key = ?
			""",
			rowMapper(), dedupeKey);
		return tasks.stream().findFirst();
	}

	/**
	 * Ids of tasks that are due, or whose lease has expired.
	 */
	public List<UUID> findClaimable(Instant now, int limit) {
		Timestamp ts = Timestamp.from(now);
		return jdbc.queryForList("""
			SELECT task_id FROM billing_task
			WHERE (status = 'PENDING' AND available_at <= ?)
			   OR (status = 'RUNNING' AND lease_until < ?)
			ORDER BY available_at, task_id
			LIMIT ?
			""",
			UUID.class, ts, ts, limit);
	}

	/**
	 * @return true if this caller now owns the task until {@code leaseUntil}
	 */
	public boolean claim(UUID taskId, Instant now, Instant leaseUntil) {
		Timestamp ts = Timestamp.from(now);
		int updated = jdbc.update("""
			UPDATE billing_task
			SET status = 'RUNNING', lease_until = ?, attempts = attempts + 1, updated_at = ?
			WHERE task_id = ?
			  AND ((status = 'PENDING' AND available_at <= ?) OR (status = 'RUNNING' AND lease_until < ?))
			""",
			Timestamp.from(leaseUntil), ts, taskId, ts, ts);
		return updated == 1;
	}

	public void complete(UUID taskId, Instant now) {
		jdbc.update("""
			UPDATE billing_task SET status = 'DONE', lease_until = NULL, last_error = NULL, updated_at = ?
			WHERE task_id = ?
			""",
			Timestamp.from(now), taskId);
	}

	public void reschedule(UUID taskId, String error, Instant availableAt, Instant now) {
		jdbc.update("""
			UPDATE billing_task SET status = 'PENDING', lease_until = NULL, last_error = ?, available_at = ?, updated_at = ?
			WHERE task_id = ?
			""",
			truncate(error), Timestamp.from(availableAt), Timestamp.from(now), taskId);
	}

	public void markDead(UUID taskId, String error, Instant now) {
		jdbc.update("""
			UPDATE billing_task SET status = 'DEAD', lease_until = NULL, last_error = ?, updated_at = ?
			WHERE task_id = ?
			""",
			truncate(error), Timestamp.from(now), taskId);
	}

	/**
	 * Put a dead task back in the queue with a fresh attempt budget.
	 */
	public boolean requeue(UUID taskId, Instant now) {
		int updated = jdbc.update("""
			UPDATE billing_task SET status = 'PENDING', attempts = 0, available_at = ?, updated_at = ?
			WHERE task_id = ? AND status = 'DEAD'
			""",
			Timestamp.from(now), Timestamp.from(now), taskId);
		return updated == 1;
	}

	public Map<String, Integer> countByStatus() {
		Map<String, Integer> counts = new LinkedHashMap<>();
		jdbc.query("SELECT status, COUNT(1) AS cnt FROM billing_task GROUP BY status ORDER BY status",
			rs -> {
				counts.put(rs.getString("status"), rs.getInt("cnt"));
			});
		return counts;
	}

	private RowMapper<BillingTask> rowMapper() {
		return (rs, rowNum) -> {
			BillingTask task = new BillingTask();
			task.setTaskId(rs.getObject("task_id", UUID.class));
			task.setTaskType(TaskType.fromCode(rs.getString("task_type")));
			task.setPayload(readPayload(rs.getString("payload_json")));
			task.setDedupeKey(rs.getString("dedupe_key"));
			task.setStatus(TaskStatus.fromCode(rs.getString("status")));
			task.setAttempts(rs.getInt("attempts"));
			task.setAvailableAt(rs.getTimestamp("available_at").toInstant());
			Timestamp lease = rs.getTimestamp("lease_until");
			task.setLeaseUntil(lease != null ? lease.toInstant() : null);
			task.setLastError(rs.getString("last_error"));
			task.setCreatedAt(rs.getTimestamp("created_at").toInstant());
			return task;
		};
	}

	private String writePayload(Map<String, Object> payload) {
		try {
			return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize task payload", e);
		}
	}

	private Map<String, Object> readPayload(String json) {
		try {
			return json != null ? objectMapper.readValue(json, PAYLOAD_TYPE) : Map.of();
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Corrupt task payload: " + json, e);
		}
	}

	private static String truncate(String error) {
		if (error == null) {
			return null;
		}
		return error.length() > 1000 ? error.substring(0, 1000) : error;
	}
}
