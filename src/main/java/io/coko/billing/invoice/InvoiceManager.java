package io.coko.billing.invoice;

import io.coko.billing.audit.AuditService;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.configstore.BillingConfigurationService;
import io.coko.billing.configstore.ConfigType;
import io.coko.billing.exception.CurrencyMismatchException;
import io.coko.billing.exception.InvalidStateTransitionException;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.SequenceConflictException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Invoice lifecycle: creation with gapless per-entity numbering, payment application,
 * overdue detection and voiding.
 */
@Service
public class InvoiceManager {

	private static final Logger log = LoggerFactory.getLogger(InvoiceManager.class);

	private static final int MAX_SEQUENCE_ATTEMPTS = 3;

	private final InvoiceRepository repository;
	private final LedgerStore ledger;
	private final BillingConfigurationService configService;
	private final AuditService auditService;
	private final BillingMetrics metrics;
	private final ApplicationEventPublisher eventPublisher;
	private final TransactionTemplate txTemplate;
	private final BillingEngineProperties props;
	private final Clock clock;

	public InvoiceManager(InvoiceRepository repository, LedgerStore ledger, BillingConfigurationService configService,
			AuditService auditService, BillingMetrics metrics, ApplicationEventPublisher eventPublisher,
			TransactionTemplate txTemplate, BillingEngineProperties props, Clock clock) {
		this.repository = repository;
		this.ledger = ledger;
		this.configService = configService;
		this.auditService = auditService;
		this.metrics = metrics;
		this.eventPublisher = eventPublisher;
		this.txTemplate = txTemplate;
		this.props = props;
		this.clock = clock;
	}

	public Invoice createInvoice(String userRef, List<InvoiceItem> items, CurrencyCode currency) {
		return createInvoice(InvoiceDraft.oneOff(props.getBillingEntity(), userRef, currency, items));
	}

	/**
	 * Validate, number and issue an invoice.
	 * For a subscription period or a settled transaction that already has an invoice, the existing
	 * invoice is returned.
	 */
	public Invoice createInvoice(InvoiceDraft draft) {
		Instant now = clock.instant();
		validate(draft, now);
		String entity = draft.getBillingEntity() != null ? draft.getBillingEntity() : props.getBillingEntity();
		int termsDays = configService.resolveIntegerOrDefault(ConfigType.PAYMENT_TERMS_DAYS, entity, now);

		Optional<Invoice> existing = findExisting(draft);
		if (existing.isPresent()) {
			return existing.get();
		}

		repository.ensureSequenceRow(entity);
		for (int attempt = 1; ; attempt++) {
			try {
				Invoice invoice = txTemplate.execute(status -> insertIssued(entity, draft, termsDays));
				LoggingUtils.setInvoiceId(invoice.getInvoiceId());
				log.info("Invoice issued: number={} user={} total={} dueAt={}",
					invoice.getInvoiceNumber(), invoice.getUserRef(), invoice.getStoredTotal(), invoice.getDueAt());
				metrics.recordInvoiceIssued();
				Map<String, Object> details = new HashMap<>();
				details.put("invoiceNumber", invoice.getInvoiceNumber());
				details.put("total", invoice.getStoredTotal().toString());
				details.put("userRef", invoice.getUserRef());
				if (!invoice.getDiscount().isZero()) {
					details.put("discount", invoice.getDiscount().toString());
				}
				auditService.logInvoiceEvent(invoice.getInvoiceId(), "ISSUED", details, "system");
				if (invoice.getStatus() == InvoiceStatus.PAID) {
					metrics.recordInvoicePaid();
					Map<String, Object> paid = new HashMap<>();
					paid.put("transactionId", String.valueOf(invoice.getSourceTransactionId()));
					paid.put("applied", invoice.getStoredTotal().toString());
					auditService.logInvoiceEvent(invoice.getInvoiceId(), "PAID", paid, "system");
				}
				return invoice;
			} catch (SequenceConflictException e) {
				Optional<Invoice> concurrent = findExisting(draft);
				if (concurrent.isPresent()) {
					log.info("Invoice for the same subscription period or transaction created concurrently: invoiceId={}",
						concurrent.get().getInvoiceId());
					return concurrent.get();
				}
				if (attempt >= MAX_SEQUENCE_ATTEMPTS) {
					throw e;
				}
				log.warn("Invoice number conflict, retrying: entity={} sequence={} attempt={}",
					e.getBillingEntity(), e.getSequenceNumber(), attempt);
			}
		}
	}

	private Optional<Invoice> findExisting(InvoiceDraft draft) {
		if (draft.getSubscriptionId() != null) {
			return repository.findBySubscriptionPeriod(draft.getSubscriptionId(), draft.getPeriodStart());
		}
		if (draft.getSourceTransactionId() != null) {
			return repository.findBySourceTransaction(draft.getSourceTransactionId());
		}
		return Optional.empty();
	}

	private Invoice insertIssued(String entity, InvoiceDraft draft, int termsDays) {
		long sequence = repository.nextSequenceNumber(entity);
		Instant now = clock.instant();

		Invoice invoice = new Invoice();
		invoice.setInvoiceId(UUID.randomUUID());
		invoice.setBillingEntity(entity);
		invoice.setSequenceNumber(sequence);
		invoice.setInvoiceNumber(formatNumber(entity, sequence));
		invoice.setUserRef(draft.getUserRef());
		invoice.setCurrency(draft.getCurrency());
		invoice.setItems(new ArrayList<>(draft.getItems()));
		invoice.setDiscount(draft.getDiscount());
		invoice.setStoredTotal(invoice.getTotal());
		invoice.setStatus(InvoiceStatus.DRAFT);
		invoice.setSubscriptionId(draft.getSubscriptionId());
		invoice.setSourceTransactionId(draft.getSourceTransactionId());
		invoice.setPeriodStart(draft.getPeriodStart());
		invoice.setPeriodEnd(draft.getPeriodEnd());
		invoice.setCreatedAt(now);
		try {
			repository.insert(invoice);
		} catch (DuplicateKeyException e) {
			throw new SequenceConflictException(entity, sequence, e);
		}

		Instant dueAt = now.plus(Duration.ofDays(termsDays));
		repository.markIssued(invoice.getInvoiceId(), now, dueAt);
		invoice.setStatus(InvoiceStatus.ISSUED);
		invoice.setIssuedAt(now);
		invoice.setDueAt(dueAt);

		if (draft.getSourceTransactionId() != null) {
			Instant paidAt = draft.getPaidAt() != null ? draft.getPaidAt() : now;
			repository.markPaid(invoice.getInvoiceId(), paidAt);
			invoice.setStatus(InvoiceStatus.PAID);
			invoice.setPaidAt(paidAt);
		}
		return invoice;
	}

	String formatNumber(String entity, long sequence) {
		return entity + "-" + String.format("%0" + props.getInvoiceNumberDigits() + "d", sequence);
	}

	private void validate(InvoiceDraft draft, Instant now) {
		if (draft.getUserRef() == null || draft.getUserRef().isBlank()) {
			throw new ValidationException("userRef is required", "userRef", draft.getUserRef());
		}
		if (draft.getCurrency() == null) {
			throw new ValidationException("currency is required", "currency", null);
		}
		if (draft.getItems() == null || draft.getItems().isEmpty()) {
			throw new ValidationException("An invoice needs at least one item", "items", null);
		}
		for (InvoiceItem item : draft.getItems()) {
			if (item.getQuantity() <= 0) {
				throw new ValidationException("Item quantity must be positive", "quantity", item.getQuantity());
			}
			if (item.getUnitPrice() == null) {
				throw new ValidationException("Item unit price is required", "unitPrice", null);
			}
			if (item.getUnitPrice().isNegative()) {
				throw new ValidationException("Item unit price must not be negative", "unitPrice", item.getUnitPrice());
			}
			if (item.getUnitPrice().getCurrency() != draft.getCurrency()) {
				throw new CurrencyMismatchException(draft.getCurrency(), item.getUnitPrice().getCurrency());
			}
			if (item.getItemType() == null) {
				throw new ValidationException("Item type is required", "itemType", null);
			}
		}
		if (draft.getSubscriptionId() != null && (draft.getPeriodStart() == null || draft.getPeriodEnd() == null)) {
			throw new ValidationException("Subscription invoices need a billing period", "periodStart", draft.getPeriodStart());
		}
		configService.requireSupportedCurrency(draft.getCurrency(), now);
		// overflow of the total surfaces here, before anything is written
		Money subtotal = Money.zero(draft.getCurrency());
		for (InvoiceItem item : draft.getItems()) {
			subtotal = subtotal.add(item.getLineTotal());
		}
		Money discount = draft.getDiscount();
		if (discount != null) {
			if (discount.getCurrency() != draft.getCurrency()) {
				throw new CurrencyMismatchException(draft.getCurrency(), discount.getCurrency());
			}
			if (discount.isNegative()) {
				throw new ValidationException("Discount must not be negative", "discount", discount);
			}
			if (subtotal.isLessThan(discount)) {
				throw new ValidationException("Discount exceeds the invoice subtotal " + subtotal, "discount", discount);
			}
		}
	}

	/**
	 * Issue an invoice, already PAID, for a settled charge that arrived without an invoice or
	 * subscription subject. Calling it again for the same transaction returns the same invoice.
	 */
	public Invoice createInvoiceFromTransaction(PaymentTransaction tx) {
		if (!tx.isSettledCharge()) {
			throw new ValidationException("Only a settled charge can be invoiced after the fact", "transactionId", tx.getId());
		}
		if (tx.getPayerRef() == null) {
			throw new ValidationException("Transaction " + tx.getExternalRef() + " names no payer", "payerRef", null);
		}
		ItemType type = ItemType.forRevenueStream(tx.getRevenueStream());
		InvoiceItem item = new InvoiceItem(describe(type, tx), 1, tx.getAmount(), type, tx.getAuthorRef());
		Instant paidAt = tx.getSettledAt() != null ? tx.getSettledAt() : clock.instant();
		Invoice invoice = createInvoice(InvoiceDraft.forSettledTransaction(props.getBillingEntity(), tx.getPayerRef(),
			tx.getAmount().getCurrency(), List.of(item), tx.getId(), paidAt));
		log.info("Invoice raised for settled transaction: invoiceId={} number={} transactionId={} ref={}",
			invoice.getInvoiceId(), invoice.getInvoiceNumber(), tx.getId(), tx.getExternalRef());
		return invoice;
	}

	private static String describe(ItemType type, PaymentTransaction tx) {
		switch (type) {
			case SUBSCRIPTION:
				return "Subscription reading";
			case TIP:
				return tx.getAuthorRef() != null ? "Tip for " + tx.getAuthorRef() : "Tip";
			default:
				return "Book purchase";
		}
	}

	public Invoice getInvoice(UUID invoiceId) {
		return repository.findById(invoiceId).orElseThrow(() -> new NotFoundException("invoice", invoiceId));
	}

	/**
	 * Row-lock an invoice for the rest of the caller's transaction.
	 */
	public Invoice lockInvoice(UUID invoiceId) {
		return repository.findByIdForUpdate(invoiceId).orElseThrow(() -> new NotFoundException("invoice", invoiceId));
	}

	public List<Invoice> listInvoices(String userRef) {
		return repository.findByUserRef(userRef);
	}

	public Optional<Invoice> findSubscriptionInvoice(UUID subscriptionId, Instant periodStart) {
		return repository.findBySubscriptionPeriod(subscriptionId, periodStart);
	}

	public List<Invoice> findOpenSubscriptionInvoices(UUID subscriptionId) {
		return repository.findOpenBySubscription(subscriptionId);
	}

	/**
	 * Void an unpaid invoice. Voiding a VOID invoice is a no-op; a PAID invoice cannot be voided.
	 * Joins the caller's transaction when there is one.
	 */
	public Invoice voidInvoice(UUID invoiceId, String reason) {
		return txTemplate.execute(status -> {
			Invoice invoice = repository.findByIdForUpdate(invoiceId)
				.orElseThrow(() -> new NotFoundException("invoice", invoiceId));
			if (invoice.getStatus() == InvoiceStatus.VOID) {
				return invoice;
			}
			if (invoice.getStatus() == InvoiceStatus.PAID) {
				throw new InvalidStateTransitionException("invoice", InvoiceStatus.PAID, InvoiceStatus.VOID);
			}
			Instant now = clock.instant();
			repository.markVoid(invoiceId, reason, now);
			invoice.setStatus(InvoiceStatus.VOID);
			invoice.setVoidedAt(now);
			invoice.setVoidReason(reason);
			log.info("Invoice voided: invoiceId={} number={} reason={}", invoiceId, invoice.getInvoiceNumber(), reason);
			metrics.recordInvoiceVoided();
			Map<String, Object> details = new HashMap<>();
			details.put("reason", reason);
			auditService.logInvoiceEvent(invoiceId, "VOIDED", details, "system");
			return invoice;
		});
	}

	/**
	 * Re-evaluate an invoice after a settled payment landed in the ledger.
	 * The applied amount is always recomputed from the ledger, so calling this twice is harmless.
	 */
	public PaymentApplication applyPayment(UUID invoiceId, UUID transactionId) {
		return txTemplate.execute(status -> {
			Invoice invoice = repository.findByIdForUpdate(invoiceId)
				.orElseThrow(() -> new NotFoundException("invoice", invoiceId));
			switch (invoice.getStatus()) {
				case VOID:
					log.warn("Payment received for void invoice, flagged for review: invoiceId={} transactionId={}",
						invoiceId, transactionId);
					Map<String, Object> flagged = new HashMap<>();
					flagged.put("transactionId", String.valueOf(transactionId));
					flagged.put("flag", "PAYMENT_ON_VOID_INVOICE");
					auditService.logInvoiceEvent(invoiceId, "PAYMENT_FLAGGED", flagged, "system");
					return PaymentApplication.FLAGGED_VOID;
				case PAID:
					return PaymentApplication.ALREADY_PAID;
				case DRAFT:
					throw new InvalidStateTransitionException("invoice", InvoiceStatus.DRAFT, InvoiceStatus.PAID);
				default:
					break;
			}
			Money applied = ledger.sumApplied(SubjectRef.invoice(invoiceId), invoice.getCurrency());
			if (applied.isLessThan(invoice.getStoredTotal())) {
				log.info("Partial payment applied: invoiceId={} applied={} total={}",
					invoiceId, applied, invoice.getStoredTotal());
				return PaymentApplication.PARTIAL;
			}
			Instant now = clock.instant();
			repository.markPaid(invoiceId, now);
			log.info("Invoice paid: invoiceId={} number={} applied={} transactionId={}",
				invoiceId, invoice.getInvoiceNumber(), applied, transactionId);
			metrics.recordInvoicePaid();
			Map<String, Object> details = new HashMap<>();
			details.put("transactionId", String.valueOf(transactionId));
			details.put("applied", applied.toString());
			auditService.logInvoiceEvent(invoiceId, "PAID", details, "system");
			eventPublisher.publishEvent(new InvoicePaidEvent(invoiceId, invoice.getSubscriptionId(),
				invoice.getPeriodStart(), invoice.getPeriodEnd(), transactionId, now));
			return PaymentApplication.PAID;
		});
	}

	/**
	 * Settle an invoice that is paid by an outgoing payout rather than by incoming charges.
	 * A VOID invoice is left as it is and the payout is flagged.
	 */
	public PaymentApplication settleByPayout(UUID invoiceId, UUID payoutTransactionId) {
		return txTemplate.execute(status -> {
			Invoice invoice = repository.findByIdForUpdate(invoiceId)
				.orElseThrow(() -> new NotFoundException("invoice", invoiceId));
			if (invoice.getStatus() == InvoiceStatus.PAID) {
				return PaymentApplication.ALREADY_PAID;
			}
			if (invoice.getStatus() == InvoiceStatus.VOID) {
				log.warn("Payout settles a void invoice, flagged for review: invoiceId={} payout={}",
					invoiceId, payoutTransactionId);
				auditService.logInvoiceEvent(invoiceId, "PAYMENT_FLAGGED",
					Map.of("transactionId", String.valueOf(payoutTransactionId), "flag", "PAYOUT_ON_VOID_INVOICE"), "system");
				return PaymentApplication.FLAGGED_VOID;
			}
			if (invoice.getStatus() == InvoiceStatus.DRAFT) {
				throw new InvalidStateTransitionException("invoice", InvoiceStatus.DRAFT, InvoiceStatus.PAID);
			}
			Instant now = clock.instant();
			repository.markPaid(invoiceId, now);
			log.info("Invoice paid by payout: invoiceId={} number={} payout={}",
				invoiceId, invoice.getInvoiceNumber(), payoutTransactionId);
			metrics.recordInvoicePaid();
			Map<String, Object> details = new HashMap<>();
			details.put("transactionId", String.valueOf(payoutTransactionId));
			details.put("applied", invoice.getStoredTotal().toString());
			auditService.logInvoiceEvent(invoiceId, "PAID", details, "system");
			return PaymentApplication.PAID;
		});
	}

	/**
	 * Counts and totals per status, for one user or, with a null {@code userRef}, for all invoices.
	 */
	public InvoiceStatistics getInvoiceStatistics(String userRef) {
		InvoiceStatistics statistics = new InvoiceStatistics(userRef);
		for (Map<String, Object> row : repository.statistics(userRef)) {
			InvoiceStatus status = InvoiceStatus.fromCode(String.valueOf(row.get("status")));
			CurrencyCode currency = CurrencyCode.fromCode(String.valueOf(row.get("currency")));
			long count = ((Number) row.get("cnt")).longValue();
			long total = ((Number) row.get("total_minor")).longValue();
			statistics.add(status, currency, count, Money.ofMinor(total, currency));
		}
		return statistics;
	}

	/**
	 * Flag every ISSUED invoice whose due date has passed.
	 * @return number of invoices moved to OVERDUE
	 */
	public int markOverdueInvoices(Instant asOf) {
		int marked = 0;
		for (UUID invoiceId : repository.findIssuedDueBefore(asOf)) {
			Boolean changed = txTemplate.execute(status -> {
				Invoice invoice = repository.findByIdForUpdate(invoiceId).orElse(null);
				if (invoice == null || invoice.getStatus() != InvoiceStatus.ISSUED) {
					return false;
				}
				repository.markOverdue(invoiceId, clock.instant());
				metrics.recordInvoiceOverdue();
				auditService.logInvoiceEvent(invoiceId, "OVERDUE", Map.of("dueAt", String.valueOf(invoice.getDueAt())), "system");
				eventPublisher.publishEvent(new InvoiceOverdueEvent(invoiceId, invoice.getSubscriptionId(),
					invoice.getDueAt(), asOf));
				return true;
			});
			if (Boolean.TRUE.equals(changed)) {
				marked++;
			}
		}
		if (marked > 0) {
			log.info("Overdue sweep: asOf={} marked={}", asOf, marked);
		}
		return marked;
	}
}
