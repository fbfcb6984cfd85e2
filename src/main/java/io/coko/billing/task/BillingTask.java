package io.coko.billing.task;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public class BillingTask {

	private UUID taskId;
	private TaskType taskType;
	private Map<String, Object> payload;
	private String dedupeKey;
	private TaskStatus status;
	private int attempts;
	private Instant availableAt;
	private Instant leaseUntil;
	private String lastError;
	private Instant createdAt;

	public UUID getTaskId() {
		return taskId;
	}

	public void setTaskId(UUID taskId) {
		this.taskId = taskId;
	}

	public TaskType getTaskType() {
		return taskType;
	}

	public void setTaskType(TaskType taskType) {
		this.taskType = taskType;
	}

	public Map<String, Object> getPayload() {
		return payload;
	}

	public void setPayload(Map<String, Object> payload) {
		this.payload = payload;
	}

	public String getDedupeKey() {
		return dedupeKey;
	}

	public void setDedupeKey(String dedupeKey) {
		this.dedupeKey = dedupeKey;
	}

	public TaskStatus getStatus() {
		return status;
	}

	public void setStatus(TaskStatus status) {
		this.status = status;
	}

	public int getAttempts() {
		return attempts;
	}

	public void setAttempts(int attempts) {
		this.attempts = attempts;
	}

	public Instant getAvailableAt() {
		return availableAt;
	}

	public void setAvailableAt(Instant availableAt) {
		this.availableAt = availableAt;
	}

	public Instant getLeaseUntil() {
		return leaseUntil;
	}

	public void setLeaseUntil(Instant leaseUntil) {
		this.leaseUntil = leaseUntil;
	}

	public String getLastError() {
		return lastError;
	}

	public void setLastError(String lastError) {
		this.lastError = lastError;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(Instant createdAt) {
		this.createdAt = createdAt;
	}

	public String payloadString(String key) {
		Object value = payload != null ? payload.get(key) : null;
		return value != null ? value.toString() : null;
	}

	@Override
	public String toString() {
		return "BillingTask{taskId=" + taskId + ", type=" + taskType + ", status=" + status
			+ ", attempts=" + attempts + ", dedupeKey='" + dedupeKey + "'}";
	}
}
