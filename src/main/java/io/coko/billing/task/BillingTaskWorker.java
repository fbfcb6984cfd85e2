package io.coko.billing.task;

import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.dlq.DeadLetterQueueService;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Claims and runs queued billing tasks.
 * Failed tasks are retried with exponential backoff; once the attempt budget is spent
 * the task is marked DEAD and copied to the dead letter queue for manual review.
 */
@Component
public class BillingTaskWorker {

	private static final Logger log = LoggerFactory.getLogger(BillingTaskWorker.class);

	private final BillingTaskQueue queue;
	private final ObjectProvider<BillingTaskHandler> handlerProvider;
	private volatile Map<TaskType, BillingTaskHandler> handlers;
	private final DeadLetterQueueService dlqService;
	private final BillingEngineProperties props;
	private final BillingMetrics metrics;
	private final Clock clock;

	/**
	 * Handlers are looked up on first use: they depend on services that enqueue tasks themselves.
	 */
	public BillingTaskWorker(BillingTaskQueue queue, ObjectProvider<BillingTaskHandler> handlerProvider,
			DeadLetterQueueService dlqService, BillingEngineProperties props, BillingMetrics metrics, Clock clock) {
		this.queue = queue;
		this.handlerProvider = handlerProvider;
		this.dlqService = dlqService;
		this.props = props;
		this.metrics = metrics;
		this.clock = clock;
	}

	private Map<TaskType, BillingTaskHandler> handlers() {
		Map<TaskType, BillingTaskHandler> resolved = handlers;
		if (resolved == null) {
			resolved = new EnumMap<>(TaskType.class);
			for (BillingTaskHandler handler : handlerProvider.orderedStream().collect(Collectors.toList())) {
				resolved.put(handler.taskType(), handler);
			}
			handlers = resolved;
		}
		return resolved;
	}

	/**
	 * Process claimable tasks until the queue has nothing due.
	 * @return number of tasks that completed successfully
	 */
	public int drain() {
		int completed = 0;
		int batchSize = props.getTasks().getBatchSize();
		while (true) {
			List<UUID> ids = queue.findClaimable(clock.instant(), batchSize);
			if (ids.isEmpty()) {
				break;
			}
			int claimedInBatch = 0;
			for (UUID id : ids) {
				TaskRunResult result = runTask(id);
				if (result != TaskRunResult.NOT_CLAIMED) {
					claimedInBatch++;
				}
				if (result == TaskRunResult.COMPLETED) {
					completed++;
				}
			}
			if (claimedInBatch == 0 || ids.size() < batchSize) {
				break;
			}
		}
		if (completed > 0) {
			log.info("Drained billing task queue: completed={}", completed);
		}
		return completed;
	}

	public TaskRunResult runTask(UUID taskId) {
		Instant now = clock.instant();
		Instant leaseUntil = now.plusSeconds(props.getTasks().getLeaseSeconds());
		if (!queue.claim(taskId, now, leaseUntil)) {
			return TaskRunResult.NOT_CLAIMED;
		}
		Optional<BillingTask> loaded = queue.findById(taskId);
		if (loaded.isEmpty()) {
			return TaskRunResult.NOT_CLAIMED;
		}
		BillingTask task = loaded.get();
		LoggingUtils.setCorrelationId(taskId.toString());
		try {
			BillingTaskHandler handler = handlers().get(task.getTaskType());
			if (handler == null) {
				throw new IllegalStateException("No handler registered for task type " + task.getTaskType());
			}
			handler.handle(task);
			queue.complete(taskId, clock.instant());
			metrics.recordTask(task.getTaskType().getCode(), "completed");
			return TaskRunResult.COMPLETED;
		} catch (RuntimeException e) {
			return handleFailure(task, e);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	private TaskRunResult handleFailure(BillingTask task, RuntimeException error) {
		Instant now = clock.instant();
		String message = error.getClass().getSimpleName() + ": " + error.getMessage();
		if (task.getAttempts() >= props.getTasks().getMaxAttempts()) {
			log.error("Billing task exhausted its attempts, moving to DLQ: {} error={}", task, message, error);
			queue.markDead(task.getTaskId(), message, now);
			dlqService.addToDLQ("TASK", task.getTaskId().toString(), task.getPayload(), error,
				task.getTaskType().getCode());
			metrics.recordTask(task.getTaskType().getCode(), "dead");
			return TaskRunResult.DEAD;
		}
		long backoff = props.getTasks().getBackoffSeconds() * (1L << Math.min(task.getAttempts() - 1, 10));
		Instant retryAt = now.plus(Duration.ofSeconds(backoff));
		log.warn("Billing task failed, will retry: {} retryAt={} error={}", task, retryAt, message);
		queue.reschedule(task.getTaskId(), message, retryAt, now);
		metrics.recordTask(task.getTaskType().getCode(), "retry");
		return TaskRunResult.RESCHEDULED;
	}

	public enum TaskRunResult {
		NOT_CLAIMED,
		COMPLETED,
		RESCHEDULED,
		DEAD
	}
}
