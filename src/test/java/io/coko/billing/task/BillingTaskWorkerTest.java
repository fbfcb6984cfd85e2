package io.coko.billing.task;

import io.coko.billing.dlq.DeadLetterQueueService;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class BillingTaskWorkerTest extends AbstractIntegrationTest {

	@Autowired
	private BillingTaskQueue queue;

	@Autowired
	private BillingTaskWorker worker;

	@Autowired
	private DeadLetterQueueService dlqService;

	@Autowired
	private LedgerStore ledger;

	private UUID enqueueApply(UUID transactionId) {
		return queue.enqueue(TaskType.APPLY_TRANSACTION, Map.of("transactionId", transactionId.toString()),
			"apply:" + transactionId, clock.instant());
	}

	@Test
	void enqueue_sameDedupeKey_keepsOneTask() {
		UUID transactionId = UUID.randomUUID();

		UUID first = enqueueApply(transactionId);
		Optional<UUID> second = queue.enqueueIfAbsent(TaskType.APPLY_TRANSACTION,
			Map.of("transactionId", transactionId.toString()), "apply:" + transactionId, clock.instant());

		assertThat(second).isEmpty();
		assertThat(queue.findByDedupeKey("apply:" + transactionId)).get()
			.extracting(BillingTask::getTaskId).isEqualTo(first);
	}

	@Test
	void runTask_completedTask_isNotRunAgain() {
		UUID transactionId = UUID.randomUUID();
		ledger.ingest(PaymentTransaction.builder()
			.id(transactionId)
			.externalRef(PaymentProvider.CARD, "ch_unmatched")
			.amount(Money.ofMinor(100, CurrencyCode.EUR))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.createdAt(clock.instant())
			.settledAt(clock.instant())
			.build());
		UUID taskId = enqueueApply(transactionId);

		assertThat(worker.runTask(taskId)).isEqualTo(BillingTaskWorker.TaskRunResult.COMPLETED);
		assertThat(worker.runTask(taskId)).isEqualTo(BillingTaskWorker.TaskRunResult.NOT_CLAIMED);
		assertThat(queue.findById(taskId)).get().extracting(BillingTask::getStatus).isEqualTo(TaskStatus.DONE);
	}

	@Test
	void failingTask_isRetriedThenDeadLetteredAndCanBeRequeued() {
		UUID transactionId = UUID.randomUUID();
		UUID taskId = enqueueApply(transactionId);

		for (int i = 0; i < 4; i++) {
			assertThat(worker.runTask(taskId)).isEqualTo(BillingTaskWorker.TaskRunResult.RESCHEDULED);
		}
		assertThat(worker.runTask(taskId)).isEqualTo(BillingTaskWorker.TaskRunResult.DEAD);

		BillingTask dead = queue.findById(taskId).orElseThrow();
		assertThat(dead.getStatus()).isEqualTo(TaskStatus.DEAD);
		assertThat(dead.getAttempts()).isEqualTo(5);
		assertThat(dead.getLastError()).contains("NotFoundException");

		List<Map<String, Object>> entries = dlqService.getUnresolvedEntries();
		assertThat(entries).hasSize(1);
		assertThat(entries.get(0).get("source_id")).isEqualTo(taskId.toString());

		ledger.ingest(PaymentTransaction.builder()
			.id(transactionId)
			.externalRef(PaymentProvider.MTN_MOMO, "momo-late")
			.amount(Money.ofMinor(500, CurrencyCode.XAF))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.createdAt(clock.instant())
			.settledAt(clock.instant())
			.build());
		dlqService.requeue((UUID) entries.get(0).get("dlq_id"), "ops");

		assertThat(worker.drain()).isEqualTo(1);
		assertThat(queue.findById(taskId)).get().extracting(BillingTask::getStatus).isEqualTo(TaskStatus.DONE);
	}
}
