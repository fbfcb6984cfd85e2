package io.coko.billing.subscription;

import io.coko.billing.audit.AuditService;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.configstore.BillingConfigurationService;
import io.coko.billing.configstore.ConfigType;
import io.coko.billing.exception.InvalidStateTransitionException;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.gateway.ChargeRequest;
import io.coko.billing.gateway.ChargeResult;
import io.coko.billing.gateway.IngestResult;
import io.coko.billing.gateway.PaymentGateway;
import io.coko.billing.gateway.PaymentGatewayRegistry;
import io.coko.billing.gateway.PaymentIngestionService;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceDraft;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.InvoiceOverdueEvent;
import io.coko.billing.invoice.InvoicePaidEvent;
import io.coko.billing.invoice.ItemType;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives subscriptions through renewal, dunning and cancellation.
 *
 * State machine:
 * ACTIVE -> RENEWAL_PENDING -> ACTIVE (paid) | PAST_DUE (failed)
 * PAST_DUE -> RENEWAL_PENDING -> ACTIVE | PAST_DUE | CANCELLED (retry budget spent)
 * any non-terminal -> PAUSED -> ACTIVE, or -> CANCELLED; fixed-term plans end in EXPIRED.
 *
 * A tick claims the subscription with an optimistic version update, so at most one charge is in
 * flight per subscription. Provider calls happen outside database transactions; every state change
 * commits in one transaction with the event that caused it.
 */
@Service
public class RecurringBillingOrchestrator {

	private static final Logger log = LoggerFactory.getLogger(RecurringBillingOrchestrator.class);

	private final SubscriptionRepository repository;
	private final InvoiceManager invoiceManager;
	private final PaymentGatewayRegistry gatewayRegistry;
	private final PaymentIngestionService paymentIngestion;
	private final RetryTemplate providerRetryTemplate;
	private final BillingConfigurationService configService;
	private final AuditService auditService;
	private final BillingMetrics metrics;
	private final TransactionTemplate txTemplate;
	private final BillingEngineProperties props;
	private final Clock clock;

	public RecurringBillingOrchestrator(SubscriptionRepository repository, InvoiceManager invoiceManager,
			PaymentGatewayRegistry gatewayRegistry, PaymentIngestionService paymentIngestion,
			RetryTemplate providerRetryTemplate, BillingConfigurationService configService, AuditService auditService,
			BillingMetrics metrics, TransactionTemplate txTemplate, BillingEngineProperties props, Clock clock) {
		this.repository = repository;
		this.invoiceManager = invoiceManager;
		this.gatewayRegistry = gatewayRegistry;
		this.paymentIngestion = paymentIngestion;
		this.providerRetryTemplate = providerRetryTemplate;
		this.configService = configService;
		this.auditService = auditService;
		this.metrics = metrics;
		this.txTemplate = txTemplate;
		this.props = props;
		this.clock = clock;
	}

	// ============ Lifecycle ============

	public Subscription createSubscription(SubscriptionRequest request) {
		Instant now = clock.instant();
		if (request.getUserRef() == null || request.getUserRef().isBlank()) {
			throw new ValidationException("userRef is required", "userRef", request.getUserRef());
		}
		if (request.getPlanCode() == null || request.getPlanCode().isBlank()) {
			throw new ValidationException("planCode is required", "planCode", request.getPlanCode());
		}
		if (request.getPrice() == null || request.getPrice().isNegative() || request.getPrice().isZero()) {
			throw new ValidationException("price must be positive", "price", request.getPrice());
		}
		if (request.getFrequency() == null) {
			throw new ValidationException("frequency is required", "frequency", null);
		}
		if (request.getProvider() == null) {
			throw new ValidationException("provider is required", "provider", null);
		}
		if (request.getPaymentMethodRef() == null || request.getPaymentMethodRef().isBlank()) {
			throw new ValidationException("paymentMethodRef is required", "paymentMethodRef", null);
		}
		if (request.getTotalCycles() != null && request.getTotalCycles() <= 0) {
			throw new ValidationException("totalCycles must be positive", "totalCycles", request.getTotalCycles());
		}
		configService.requireSupportedCurrency(request.getPrice().getCurrency(), now);

		Instant startAt = request.getStartAt() != null ? request.getStartAt() : now;
		Subscription sub = new Subscription();
		sub.setSubscriptionId(UUID.randomUUID());
		sub.setUserRef(request.getUserRef());
		sub.setPlanCode(request.getPlanCode());
		sub.setPrice(request.getPrice());
		sub.setFrequency(request.getFrequency());
		sub.setProvider(request.getProvider());
		sub.setPaymentMethodRef(request.getPaymentMethodRef());
		sub.setStatus(SubscriptionStatus.ACTIVE);
		sub.setStartAt(startAt);
		sub.setCurrentPeriodEnd(startAt);
		sub.setTotalCycles(request.getTotalCycles());
		sub.setCreatedAt(now);
		sub.setUpdatedAt(now);
		repository.insert(sub);

		log.info("Subscription created: subscriptionId={} user={} plan={} price={} frequency={} provider={}",
			sub.getSubscriptionId(), sub.getUserRef(), sub.getPlanCode(), sub.getPrice(), sub.getFrequency(),
			sub.getProvider());
		Map<String, Object> details = new HashMap<>();
		details.put("plan", sub.getPlanCode());
		details.put("price", sub.getPrice().toString());
		details.put("frequency", sub.getFrequency().getCode());
		auditService.logSubscriptionEvent(sub.getSubscriptionId(), "CREATED", details, sub.getUserRef());
		return sub;
	}

	public Subscription getSubscription(UUID subscriptionId) {
		return repository.findById(subscriptionId)
			.orElseThrow(() -> new NotFoundException("subscription", subscriptionId));
	}

	public List<ChargeAttempt> getChargeAttempts(UUID subscriptionId) {
		return repository.findAttempts(subscriptionId);
	}

	/**
	 * Stop scheduling further charges. A charge already in flight still completes.
	 */
	public Subscription pauseSubscription(UUID subscriptionId) {
		return txTemplate.execute(status -> {
			Subscription sub = lock(subscriptionId);
			if (sub.getStatus() == SubscriptionStatus.PAUSED) {
				return sub;
			}
			if (sub.getStatus().isTerminal()) {
				throw new InvalidStateTransitionException("subscription", sub.getStatus(), SubscriptionStatus.PAUSED);
			}
			if (sub.getStatus() != SubscriptionStatus.RENEWAL_PENDING) {
				sub.setResumeStatus(sub.getStatus());
			}
			return transition(sub, SubscriptionStatus.PAUSED, "PAUSED", Map.of());
		});
	}

	public Subscription resumeSubscription(UUID subscriptionId) {
		return txTemplate.execute(status -> {
			Subscription sub = lock(subscriptionId);
			if (sub.getStatus() == SubscriptionStatus.ACTIVE) {
				return sub;
			}
			if (sub.getStatus() != SubscriptionStatus.PAUSED) {
				throw new InvalidStateTransitionException("subscription", sub.getStatus(), SubscriptionStatus.ACTIVE);
			}
			sub.setResumeStatus(null);
			return transition(sub, SubscriptionStatus.ACTIVE, "RESUMED", Map.of());
		});
	}

	/**
	 * Cancel for good. Unpaid invoices are voided unless a charge for them is still in flight;
	 * such a charge completes and is recorded normally.
	 */
	public Subscription cancelSubscription(UUID subscriptionId) {
		return txTemplate.execute(status -> {
			// invoice rows first, then the subscription: same order as payment application
			List<Invoice> open = invoiceManager.findOpenSubscriptionInvoices(subscriptionId);
			for (Invoice invoice : open) {
				invoiceManager.lockInvoice(invoice.getInvoiceId());
			}
			Subscription sub = lock(subscriptionId);
			if (sub.getStatus() == SubscriptionStatus.CANCELLED) {
				return sub;
			}
			if (sub.getStatus() == SubscriptionStatus.EXPIRED) {
				throw new InvalidStateTransitionException("subscription", sub.getStatus(), SubscriptionStatus.CANCELLED);
			}
			Optional<ChargeAttempt> latest = repository.findLatestAttempt(subscriptionId);
			boolean inFlight = latest.isPresent() && latest.get().getStatus() == ChargeAttemptStatus.PENDING;
			if (!inFlight) {
				for (Invoice invoice : open) {
					invoiceManager.voidInvoice(invoice.getInvoiceId(), "subscription_cancelled");
				}
			}
			sub.setNextRetryAt(null);
			return transition(sub, SubscriptionStatus.CANCELLED, "CANCELLED", Map.of("chargeInFlight", inFlight));
		});
	}

	// ============ Renewal ============

	/**
	 * Run one renewal step for a subscription if it is due at {@code now}.
	 */
	public TickResult tick(UUID subscriptionId, Instant now) {
		LoggingUtils.setSubscriptionId(subscriptionId);
		try {
			Subscription sub = getSubscription(subscriptionId);
			Optional<ChargeAttempt> latest = repository.findLatestAttempt(subscriptionId);
			if (!isDue(sub, latest.orElse(null), now)) {
				return TickResult.NOT_DUE;
			}
			if (!repository.claim(subscriptionId, sub.getVersion(), now)) {
				log.info("Renewal claim lost: subscriptionId={} version={}", subscriptionId, sub.getVersion());
				return TickResult.CLAIM_LOST;
			}
			sub = getSubscription(subscriptionId);
			return renew(sub, latest.orElse(null), now);
		} finally {
			LoggingUtils.clearSubscriptionId();
		}
	}

	boolean isDue(Subscription sub, ChargeAttempt latest, Instant now) {
		switch (sub.getStatus()) {
			case ACTIVE:
				return !sub.getCurrentPeriodEnd().isAfter(now)
					&& (sub.getNextRetryAt() == null || !sub.getNextRetryAt().isAfter(now));
			case PAST_DUE:
				return sub.getNextRetryAt() != null && !sub.getNextRetryAt().isAfter(now);
			case RENEWAL_PENDING:
				return isStaleClaim(sub, latest, now);
			default:
				return false;
		}
	}

	private boolean isStaleClaim(Subscription sub, ChargeAttempt latest, Instant now) {
		BillingEngineProperties.Orchestrator settings = props.getOrchestrator();
		if (latest != null && latest.getStatus() == ChargeAttemptStatus.PENDING) {
			// resend with the same attempt id; the provider deduplicates
			return latest.getUpdatedAt().plusSeconds(settings.getPendingChargeTimeoutSeconds()).isBefore(now);
		}
		return sub.getClaimedAt() == null
			|| sub.getClaimedAt().plusSeconds(settings.getStaleClaimSeconds()).isBefore(now);
	}

	private TickResult renew(Subscription sub, ChargeAttempt latest, Instant now) {
		Instant periodStart = sub.getCurrentPeriodEnd();
		Instant periodEnd = sub.getFrequency().next(periodStart);
		InvoiceItem item = new InvoiceItem(sub.getPlanCode() + " subscription", 1, sub.getPrice(), ItemType.SUBSCRIPTION);
		Invoice invoice;
		PaymentGateway gateway;
		try {
			invoice = invoiceManager.createInvoice(InvoiceDraft.forSubscriptionPeriod(props.getBillingEntity(),
				sub.getUserRef(), sub.getPrice().getCurrency(), List.of(item), sub.getSubscriptionId(), periodStart, periodEnd));
			gateway = gatewayRegistry.get(sub.getProvider());
		} catch (RuntimeException e) {
			log.error("Renewal aborted before charging, claim released: subscriptionId={} error={}",
				sub.getSubscriptionId(), e.getMessage());
			releaseClaim(sub.getSubscriptionId());
			throw e;
		}
		LoggingUtils.setInvoiceId(invoice.getInvoiceId());

		if (!invoice.getStatus().isOpen()) {
			log.warn("Renewal skipped, period invoice is {}: subscriptionId={} invoice={}",
				invoice.getStatus(), sub.getSubscriptionId(), invoice.getInvoiceNumber());
			releaseClaim(sub.getSubscriptionId());
			return TickResult.SKIPPED;
		}

		ChargeAttempt attempt = prepareAttempt(sub, invoice, latest, now);
		ChargeRequest request = new ChargeRequest(attempt.getAttemptId(), SubjectRef.invoice(invoice.getInvoiceId()),
			invoice.getStoredTotal(), sub.getPaymentMethodRef(), sub.getUserRef(),
			"Coko " + sub.getPlanCode() + " " + invoice.getInvoiceNumber());
		LoggingUtils.setProvider(sub.getProvider().getCode());

		ChargeResult result;
		try {
			result = providerRetryTemplate.execute(context -> gateway.initiateCharge(request));
		} catch (ProviderException e) {
			if (e.isTransient()) {
				metrics.recordChargeResult(sub.getProvider().getCode(), "error");
				onTransientError(sub.getSubscriptionId(), attempt, e);
				return TickResult.TRANSIENT_ERROR;
			}
			log.warn("Charge permanently rejected: attemptId={} code={} message={}",
				attempt.getAttemptId(), e.getProviderCode(), e.getMessage());
			result = ChargeResult.failed(null, e.getProviderCode() != null ? e.getProviderCode() : "rejected");
		}
		metrics.recordChargeResult(sub.getProvider().getCode(), result.getStatus().name().toLowerCase());
		log.info("Charge result: attemptId={} invoice={} result={}", attempt.getAttemptId(),
			invoice.getInvoiceNumber(), result);

		switch (result.getStatus()) {
			case SETTLED:
				repository.updateAttempt(attempt.getAttemptId(), ChargeAttemptStatus.PENDING,
					result.getProviderTransactionId(), null, clock.instant());
				IngestResult settled = paymentIngestion.ingest(chargeTransaction(sub, invoice, attempt, result,
					TransactionStatus.SETTLED));
				invoiceManager.applyPayment(invoice.getInvoiceId(), settled.getTransactionId());
				return TickResult.PAID;
			case FAILED:
				repository.updateAttempt(attempt.getAttemptId(), ChargeAttemptStatus.PENDING,
					result.getProviderTransactionId(), result.getFailureCode(), clock.instant());
				IngestResult failed = paymentIngestion.ingest(chargeTransaction(sub, invoice, attempt, result,
					TransactionStatus.FAILED));
				onChargeFailed(invoice.getInvoiceId(), failed.getTransactionId(), result.getFailureCode());
				return getSubscription(sub.getSubscriptionId()).getStatus() == SubscriptionStatus.CANCELLED
					? TickResult.CANCELLED : TickResult.FAILED;
			default:
				repository.updateAttempt(attempt.getAttemptId(), ChargeAttemptStatus.PENDING,
					result.getProviderTransactionId(), null, clock.instant());
				return TickResult.PENDING;
		}
	}

	/**
	 * Reuse the attempt id of an unresolved attempt for the same invoice, otherwise record a new one.
	 */
	private ChargeAttempt prepareAttempt(Subscription sub, Invoice invoice, ChargeAttempt latest, Instant now) {
		if (latest != null && latest.isUnresolved() && invoice.getInvoiceId().equals(latest.getInvoiceId())) {
			repository.updateAttempt(latest.getAttemptId(), ChargeAttemptStatus.PENDING, null, null, now);
			latest.setStatus(ChargeAttemptStatus.PENDING);
			log.info("Resending charge attempt: attemptId={} attemptNumber={}", latest.getAttemptId(),
				latest.getAttemptNumber());
			return latest;
		}
		ChargeAttempt attempt = new ChargeAttempt();
		attempt.setAttemptId(UUID.randomUUID());
		attempt.setSubscriptionId(sub.getSubscriptionId());
		attempt.setInvoiceId(invoice.getInvoiceId());
		attempt.setAttemptNumber(repository.countAttempts(sub.getSubscriptionId()) + 1);
		attempt.setProvider(sub.getProvider());
		attempt.setStatus(ChargeAttemptStatus.PENDING);
		attempt.setCreatedAt(now);
		attempt.setUpdatedAt(now);
		repository.insertAttempt(attempt);
		return attempt;
	}

	private PaymentTransaction chargeTransaction(Subscription sub, Invoice invoice, ChargeAttempt attempt,
			ChargeResult result, TransactionStatus status) {
		Instant now = clock.instant();
		String providerTxnId = result.getProviderTransactionId() != null
			? result.getProviderTransactionId() : attempt.getAttemptId().toString();
		PaymentTransaction.Builder builder = PaymentTransaction.builder()
			.externalRef(sub.getProvider(), providerTxnId)
			.amount(invoice.getStoredTotal())
			.kind(TransactionKind.CHARGE)
			.status(status)
			.subjectRef(SubjectRef.invoice(invoice.getInvoiceId()))
			.payerRef(sub.getUserRef())
			.createdAt(now);
		if (status == TransactionStatus.SETTLED) {
			builder.settledAt(now);
		} else {
			builder.failureCode(result.getFailureCode());
		}
		return builder.build();
	}

	private void onTransientError(UUID subscriptionId, ChargeAttempt attempt, ProviderException error) {
		txTemplate.executeWithoutResult(status -> {
			Instant now = clock.instant();
			Subscription sub = lock(subscriptionId);
			repository.updateAttempt(attempt.getAttemptId(), ChargeAttemptStatus.ERROR, null, "transient", now);
			Instant retryAt = now.plusSeconds(props.getOrchestrator().getTransientRetryDelaySeconds());
			if (sub.getStatus() == SubscriptionStatus.RENEWAL_PENDING) {
				sub.setStatus(sub.getResumeStatus() != null ? sub.getResumeStatus() : SubscriptionStatus.ACTIVE);
				sub.setResumeStatus(null);
				sub.setNextRetryAt(retryAt);
			}
			sub.setClaimedAt(null);
			repository.update(sub, now);
			log.warn("Charge hit a transient provider error, attempt kept for resend: attemptId={} retryAt={} error={}",
				attempt.getAttemptId(), retryAt, error.getMessage());
			Map<String, Object> details = new HashMap<>();
			details.put("attemptId", attempt.getAttemptId().toString());
			details.put("retryAt", retryAt.toString());
			auditService.logSubscriptionEvent(subscriptionId, "CHARGE_TRANSIENT_ERROR", details, "system");
		});
	}

	private void releaseClaim(UUID subscriptionId) {
		txTemplate.executeWithoutResult(status -> {
			Subscription sub = lock(subscriptionId);
			if (sub.getStatus() == SubscriptionStatus.RENEWAL_PENDING) {
				sub.setStatus(sub.getResumeStatus() != null ? sub.getResumeStatus() : SubscriptionStatus.ACTIVE);
				sub.setResumeStatus(null);
			}
			sub.setClaimedAt(null);
			repository.update(sub, clock.instant());
		});
	}

	// ============ Payment outcomes ============

	/**
	 * Apply a failed charge to the subscription owning {@code invoiceId}. Acts only while the latest
	 * attempt for that invoice is unresolved, so repeated deliveries change nothing.
	 */
	public void onChargeFailed(UUID invoiceId, UUID transactionId, String failureCode) {
		txTemplate.executeWithoutResult(status -> {
			Invoice invoice = invoiceManager.lockInvoice(invoiceId);
			if (invoice.getSubscriptionId() == null) {
				return;
			}
			Subscription sub = lock(invoice.getSubscriptionId());
			Optional<ChargeAttempt> latest = repository.findLatestAttempt(sub.getSubscriptionId());
			if (latest.isEmpty() || !latest.get().isUnresolved() || !invoiceId.equals(latest.get().getInvoiceId())) {
				log.debug("Failed charge already applied: invoiceId={} transactionId={}", invoiceId, transactionId);
				return;
			}
			Instant now = clock.instant();
			repository.updateAttempt(latest.get().getAttemptId(), ChargeAttemptStatus.FAILED, null,
				failureCode != null ? failureCode : "declined", now);
			sub.setClaimedAt(null);

			if (sub.getStatus().isTerminal()) {
				if (invoice.getStatus().isOpen()) {
					invoiceManager.voidInvoice(invoiceId, "subscription_" + sub.getStatus().getCode().toLowerCase());
				}
				repository.update(sub, now);
				return;
			}

			int failures = sub.getFailedAttemptCount() + 1;
			int maxRetries = configService.resolveInteger(ConfigType.MAX_RETRY_COUNT, ConfigType.DEFAULT_KEY, now);
			sub.setFailedAttemptCount(failures);
			Map<String, Object> details = new HashMap<>();
			details.put("invoiceId", invoiceId.toString());
			details.put("failures", failures);
			details.put("failureCode", failureCode);

			if (failures > maxRetries) {
				sub.setNextRetryAt(null);
				sub.setResumeStatus(null);
				invoiceManager.voidInvoice(invoiceId, "dunning_exhausted");
				transition(sub, SubscriptionStatus.CANCELLED, "DUNNING_EXHAUSTED", details);
				return;
			}
			if (sub.getStatus() == SubscriptionStatus.PAUSED) {
				sub.setResumeStatus(SubscriptionStatus.PAST_DUE);
				repository.update(sub, now);
				auditService.logSubscriptionEvent(sub.getSubscriptionId(), "CHARGE_FAILED", details, "system");
				return;
			}
			List<Integer> schedule = configService.resolveDays(ConfigType.DUNNING_SCHEDULE, ConfigType.DEFAULT_KEY, now);
			int offsetDays = schedule.get(Math.min(failures - 1, schedule.size() - 1));
			sub.setNextRetryAt(now.plus(Duration.ofDays(offsetDays)));
			sub.setResumeStatus(null);
			details.put("nextRetryAt", sub.getNextRetryAt().toString());
			transition(sub, SubscriptionStatus.PAST_DUE, "CHARGE_FAILED", details);
		});
	}

	/**
	 * Advance the billing period once the period invoice is paid. Runs in the transaction that
	 * marked the invoice paid.
	 */
	@EventListener
	public void onInvoicePaid(InvoicePaidEvent event) {
		if (event.getSubscriptionId() == null) {
			return;
		}
		Subscription sub = lock(event.getSubscriptionId());
		if (!sub.getCurrentPeriodEnd().equals(event.getPeriodStart())) {
			log.warn("Paid invoice does not match the current period, period not advanced: subscriptionId={} "
				+ "invoiceId={} periodStart={} currentPeriodEnd={}", sub.getSubscriptionId(), event.getInvoiceId(),
				event.getPeriodStart(), sub.getCurrentPeriodEnd());
			return;
		}
		Instant now = clock.instant();
		repository.settleUnresolvedAttempts(sub.getSubscriptionId(), event.getInvoiceId(), now);
		sub.setCurrentPeriodEnd(event.getPeriodEnd());
		sub.setFailedAttemptCount(0);
		sub.setNextRetryAt(null);
		sub.setClaimedAt(null);
		sub.setCompletedCycles(sub.getCompletedCycles() + 1);

		SubscriptionStatus next;
		if (sub.getStatus() == SubscriptionStatus.PAUSED || sub.getStatus() == SubscriptionStatus.CANCELLED) {
			next = sub.getStatus();
			if (next == SubscriptionStatus.PAUSED) {
				sub.setResumeStatus(SubscriptionStatus.ACTIVE);
			}
		} else if (sub.getTotalCycles() != null && sub.getCompletedCycles() >= sub.getTotalCycles()) {
			next = SubscriptionStatus.EXPIRED;
		} else {
			next = SubscriptionStatus.ACTIVE;
			sub.setResumeStatus(null);
		}
		Map<String, Object> details = new HashMap<>();
		details.put("invoiceId", event.getInvoiceId().toString());
		details.put("periodEnd", event.getPeriodEnd().toString());
		transition(sub, next, "RENEWED", details);
	}

	/**
	 * An unpaid subscription invoice past its due date moves the subscription to PAST_DUE.
	 */
	@EventListener
	public void onInvoiceOverdue(InvoiceOverdueEvent event) {
		if (event.getSubscriptionId() == null) {
			return;
		}
		Subscription sub = lock(event.getSubscriptionId());
		if (sub.getStatus() == SubscriptionStatus.ACTIVE) {
			if (sub.getNextRetryAt() == null) {
				sub.setNextRetryAt(event.getDetectedAt());
			}
			transition(sub, SubscriptionStatus.PAST_DUE, "INVOICE_OVERDUE", Map.of("invoiceId", event.getInvoiceId().toString()));
		} else if (sub.getStatus() == SubscriptionStatus.RENEWAL_PENDING) {
			sub.setResumeStatus(SubscriptionStatus.PAST_DUE);
			repository.update(sub, clock.instant());
		}
	}

	private Subscription lock(UUID subscriptionId) {
		return repository.findByIdForUpdate(subscriptionId)
			.orElseThrow(() -> new NotFoundException("subscription", subscriptionId));
	}

	private Subscription transition(Subscription sub, SubscriptionStatus to, String action, Map<String, Object> extra) {
		SubscriptionStatus from = sub.getStatus();
		sub.setStatus(to);
		repository.update(sub, clock.instant());
		log.info("Subscription {}: subscriptionId={} {} -> {}", action, sub.getSubscriptionId(), from, to);
		if (from != to) {
			metrics.recordSubscriptionTransition(to.getCode());
		}
		Map<String, Object> details = new HashMap<>(extra);
		details.put("from", from.getCode());
		details.put("to", to.getCode());
		auditService.logSubscriptionEvent(sub.getSubscriptionId(), action, details, "system");
		return sub;
	}
}
