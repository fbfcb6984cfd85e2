package io.coko.billing.subscription;

import io.coko.billing.audit.AuditService;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.PaymentApplication;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.task.BillingTask;
import io.coko.billing.task.BillingTaskHandler;
import io.coko.billing.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies a freshly ingested ledger transaction to invoices and subscriptions.
 * Every branch is idempotent; the task may run more than once.
 */
@Component
public class PaymentEventDispatcher implements BillingTaskHandler {

	private static final Logger log = LoggerFactory.getLogger(PaymentEventDispatcher.class);

	private final LedgerStore ledger;
	private final InvoiceManager invoiceManager;
	private final RecurringBillingOrchestrator orchestrator;
	private final AuditService auditService;

	public PaymentEventDispatcher(LedgerStore ledger, InvoiceManager invoiceManager,
			RecurringBillingOrchestrator orchestrator, AuditService auditService) {
		this.ledger = ledger;
		this.invoiceManager = invoiceManager;
		this.orchestrator = orchestrator;
		this.auditService = auditService;
	}

	@Override
	public TaskType taskType() {
		return TaskType.APPLY_TRANSACTION;
	}

	@Override
	public void handle(BillingTask task) {
		String idText = task.payloadString("transactionId");
		if (idText == null) {
			throw new ValidationException("Task payload has no transactionId", "transactionId", null);
		}
		UUID transactionId = UUID.fromString(idText);
		PaymentTransaction tx = ledger.findById(transactionId)
			.orElseThrow(() -> new NotFoundException("transaction", transactionId));

		if (tx.getSubjectRef() == null) {
			if (tx.isSettledCharge() && tx.getPayerRef() != null) {
				Invoice invoice = invoiceManager.createInvoiceFromTransaction(tx);
				log.info("Standalone purchase invoiced: transactionId={} invoiceId={} number={}",
					transactionId, invoice.getInvoiceId(), invoice.getInvoiceNumber());
				return;
			}
			log.info("Transaction has no billing subject, nothing to apply: transactionId={} ref={}",
				transactionId, tx.getExternalRef());
			return;
		}
		if (tx.isMoneyReturned()) {
			recordReturn(tx);
			return;
		}
		UUID invoiceId = resolveInvoice(tx.getSubjectRef());
		if (invoiceId == null) {
			log.warn("No open invoice for transaction subject, left for review: transactionId={} subject={}",
				transactionId, tx.getSubjectRef());
			auditService.logPayment(transactionId, "UNMATCHED", Map.of("subject", tx.getSubjectRef().toString()));
			return;
		}

		if (tx.isSettledCharge()) {
			PaymentApplication result = invoiceManager.applyPayment(invoiceId, transactionId);
			log.info("Settled charge applied: transactionId={} invoiceId={} result={}", transactionId, invoiceId, result);
		} else if (tx.isFailedCharge()) {
			orchestrator.onChargeFailed(invoiceId, transactionId, tx.getFailureCode());
		}
	}

	private UUID resolveInvoice(SubjectRef subject) {
		if (subject.isInvoice()) {
			return subject.getId();
		}
		List<Invoice> open = invoiceManager.findOpenSubscriptionInvoices(subject.getId());
		return open.isEmpty() ? null : open.get(0).getInvoiceId();
	}

	private void recordReturn(PaymentTransaction tx) {
		String action = tx.getStatus() == TransactionStatus.REVERSED ? "CHARGEBACK_RECORDED" : "REFUND_RECORDED";
		log.info("Money returned to payer: transactionId={} kind={} status={} amount={} relatedTo={}",
			tx.getId(), tx.getKind(), tx.getStatus(), tx.getAmount(), tx.getRelatedProviderTransactionId());
		Map<String, Object> details = new HashMap<>();
		details.put("amount", tx.getAmount().toString());
		details.put("subject", tx.getSubjectRef().toString());
		details.put("relatedProviderTransactionId", tx.getRelatedProviderTransactionId());
		auditService.logPayment(tx.getId(), action, details);
	}
}
