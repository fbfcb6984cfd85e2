package io.coko.billing.gateway;

import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceRepository;
import io.coko.billing.ledger.IngestOutcome;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.task.BillingTaskQueue;
import io.coko.billing.task.BillingTaskWorker;
import io.coko.billing.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Single entry point for money movements reported by providers, whether they come from a
 * webhook or from a synchronous charge response.
 *
 * The ledger insert and the follow-up task commit together; a duplicate commits nothing.
 * The task is then run inline on a best-effort basis and otherwise left to the worker.
 */
@Service
public class PaymentIngestionService {

	private static final Logger log = LoggerFactory.getLogger(PaymentIngestionService.class);

	private final LedgerStore ledger;
	private final BillingTaskQueue taskQueue;
	private final BillingTaskWorker taskWorker;
	private final InvoiceRepository invoiceRepository;
	private final BillingMetrics metrics;
	private final TransactionTemplate requiresNewTx;
	private final BillingEngineProperties props;
	private final Clock clock;

	public PaymentIngestionService(LedgerStore ledger, BillingTaskQueue taskQueue, BillingTaskWorker taskWorker,
			InvoiceRepository invoiceRepository, BillingMetrics metrics,
			@Qualifier("requiresNewTransactionTemplate") TransactionTemplate requiresNewTx,
			BillingEngineProperties props, Clock clock) {
		this.ledger = ledger;
		this.taskQueue = taskQueue;
		this.taskWorker = taskWorker;
		this.invoiceRepository = invoiceRepository;
		this.metrics = metrics;
		this.requiresNewTx = requiresNewTx;
		this.props = props;
		this.clock = clock;
	}

	public IngestResult ingest(PaymentTransaction reported) {
		PaymentTransaction tx = attributeAuthor(resolveSubscriptionSubject(reported));
		UUID[] taskId = new UUID[1];

		IngestOutcome outcome = requiresNewTx.execute(status -> {
			IngestOutcome result = ledger.ingest(tx);
			if (result == IngestOutcome.DUPLICATE) {
				status.setRollbackOnly();
				return result;
			}
			Map<String, Object> payload = new HashMap<>();
			payload.put("transactionId", tx.getId().toString());
			payload.put("provider", tx.getProvider().getCode());
			payload.put("providerTransactionId", tx.getProviderTransactionId());
			taskId[0] = taskQueue.enqueue(TaskType.APPLY_TRANSACTION, payload, "apply:" + tx.getId(), clock.instant());
			return result;
		});
		metrics.recordLedgerIngest(tx.getProvider().getCode(), outcome.name().toLowerCase());

		if (outcome == IngestOutcome.DUPLICATE) {
			UUID existingId = ledger.findByExternalRef(tx.getExternalRef()).map(PaymentTransaction::getId).orElse(null);
			log.info("Duplicate provider event ignored: ref={} existingTransactionId={}", tx.getExternalRef(), existingId);
			return IngestResult.duplicate(existingId);
		}

		if (props.getTasks().isRunInline() && taskId[0] != null) {
			try {
				taskWorker.runTask(taskId[0]);
			} catch (RuntimeException e) {
				log.warn("Inline run of apply task failed, left for the worker: taskId={} transactionId={} error={}",
					taskId[0], tx.getId(), e.getMessage());
			}
		}
		return IngestResult.inserted(tx.getId());
	}

	/**
	 * A charge reported against a subscription pays its oldest open invoice; the ledger row records
	 * that invoice as subject so the invoice's applied amount includes it.
	 */
	PaymentTransaction resolveSubscriptionSubject(PaymentTransaction tx) {
		if (tx.getSubjectRef() == null || !tx.getSubjectRef().isSubscription() || tx.getKind() != TransactionKind.CHARGE) {
			return tx;
		}
		List<Invoice> open = invoiceRepository.findOpenBySubscription(tx.getSubjectRef().getId());
		if (open.isEmpty()) {
			return tx;
		}
		UUID invoiceId = open.get(0).getInvoiceId();
		log.info("Subscription charge routed to open invoice: ref={} subscription={} invoiceId={}",
			tx.getExternalRef(), tx.getSubjectRef().getId(), invoiceId);
		return tx.toBuilder().subjectRef(SubjectRef.invoice(invoiceId)).build();
	}

	/**
	 * Attribute an invoice payment to an author when every item of the invoice names the same one.
	 * The revenue stream follows the item type when the items agree on it.
	 */
	PaymentTransaction attributeAuthor(PaymentTransaction tx) {
		if (tx.getAuthorRef() != null || tx.getSubjectRef() == null || !tx.getSubjectRef().isInvoice()
				|| tx.getKind() == TransactionKind.PAYOUT) {
			return tx;
		}
		List<InvoiceItem> items = invoiceRepository.findItems(tx.getSubjectRef().getId());
		if (items.isEmpty() || items.stream().anyMatch(i -> i.getAuthorRef() == null)) {
			return tx;
		}
		List<String> authors = items.stream().map(InvoiceItem::getAuthorRef).distinct().collect(Collectors.toList());
		if (authors.size() != 1) {
			return tx;
		}
		PaymentTransaction.Builder builder = tx.toBuilder().authorRef(authors.get(0));
		if (tx.getRevenueStream() == null) {
			List<RevenueStream> streams = items.stream()
				.map(i -> i.getItemType().getRevenueStream())
				.filter(Objects::nonNull)
				.distinct()
				.collect(Collectors.toList());
			if (streams.size() == 1) {
				builder.revenueStream(streams.get(0));
			}
		}
		return builder.build();
	}
}
