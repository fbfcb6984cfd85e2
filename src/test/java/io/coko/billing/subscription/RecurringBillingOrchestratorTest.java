package io.coko.billing.subscription;

import io.coko.billing.exception.InvalidStateTransitionException;
import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.gateway.ChargeRequest;
import io.coko.billing.gateway.ChargeResult;
import io.coko.billing.gateway.IngestResult;
import io.coko.billing.gateway.PaymentGateway;
import io.coko.billing.gateway.PaymentGatewayRegistry;
import io.coko.billing.gateway.PaymentIngestionService;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.InvoiceStatus;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecurringBillingOrchestratorTest extends AbstractIntegrationTest {

	@MockBean
	private PaymentGatewayRegistry gatewayRegistry;

	@Autowired
	private RecurringBillingOrchestrator orchestrator;

	@Autowired
	private InvoiceManager invoiceManager;

	@Autowired
	private PaymentIngestionService paymentIngestion;

	private PaymentGateway gateway;

	@BeforeEach
	void stubGateway() {
		gateway = Mockito.mock(PaymentGateway.class);
		when(gateway.provider()).thenReturn(PaymentProvider.CARD);
		when(gatewayRegistry.get(PaymentProvider.CARD)).thenReturn(gateway);
	}

	private Subscription subscribe(Integer totalCycles) {
		SubscriptionRequest request = new SubscriptionRequest();
		request.setUserRef("reader-1");
		request.setPlanCode("premium");
		request.setPrice(Money.ofMinor(999, CurrencyCode.EUR));
		request.setFrequency(BillingFrequency.MONTHLY);
		request.setProvider(PaymentProvider.CARD);
		request.setPaymentMethodRef("pm_card_visa");
		request.setTotalCycles(totalCycles);
		return orchestrator.createSubscription(request);
	}

	private IngestResult settleAsync(UUID subscriptionId, String providerTxnId) {
		Instant now = clock.instant();
		return paymentIngestion.ingest(PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, providerTxnId)
			.amount(Money.ofMinor(999, CurrencyCode.EUR))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.subjectRef(SubjectRef.subscription(subscriptionId))
			.createdAt(now)
			.settledAt(now)
			.build());
	}

	private int auditRows(String entityType, String action) {
		Integer rows = jdbc.queryForObject(
			"SELECT COUNT(1) FROM billing_audit_log WHERE entity_type = ? AND action = ?", Integer.class, entityType, action);
		return rows != null ? rows : 0;
	}

	private Invoice onlyInvoice() {
		List<Invoice> invoices = invoiceManager.listInvoices("reader-1");
		assertThat(invoices).hasSize(1);
		return invoices.get(0);
	}

	// ============ Creation ============

	@Test
	void createSubscription_isActiveAndDueImmediately() {
		Subscription sub = subscribe(null);

		assertThat(sub.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
		assertThat(sub.getCurrentPeriodEnd()).isEqualTo(clock.instant());
	}

	@Test
	void createSubscription_zeroPrice_isRejected() {
		SubscriptionRequest request = new SubscriptionRequest();
		request.setUserRef("reader-1");
		request.setPlanCode("premium");
		request.setPrice(Money.ofMinor(0, CurrencyCode.EUR));
		request.setFrequency(BillingFrequency.MONTHLY);
		request.setProvider(PaymentProvider.CARD);
		request.setPaymentMethodRef("pm_card_visa");

		assertThatThrownBy(() -> orchestrator.createSubscription(request)).isInstanceOf(ValidationException.class);
	}

	// ============ Renewal ============

	@Test
	void tick_settledCharge_paysInvoiceAndAdvancesPeriod() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.settled("ch_1"));
		Subscription sub = subscribe(null);
		Instant start = clock.instant();

		assertThat(orchestrator.tick(sub.getSubscriptionId(), clock.instant())).isEqualTo(TickResult.PAID);

		Subscription renewed = orchestrator.getSubscription(sub.getSubscriptionId());
		assertThat(renewed.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
		assertThat(renewed.getCurrentPeriodEnd()).isEqualTo(BillingFrequency.MONTHLY.next(start));
		assertThat(renewed.getCompletedCycles()).isEqualTo(1);
		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.PAID);
		assertThat(orchestrator.getChargeAttempts(sub.getSubscriptionId()))
			.extracting(ChargeAttempt::getStatus).containsExactly(ChargeAttemptStatus.SETTLED);

		assertThat(orchestrator.tick(sub.getSubscriptionId(), clock.instant())).isEqualTo(TickResult.NOT_DUE);
		verify(gateway, times(1)).initiateCharge(any());
	}

	@Test
	void tick_lastCycle_expiresSubscription() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.settled("ch_1"));
		Subscription sub = subscribe(1);

		orchestrator.tick(sub.getSubscriptionId(), clock.instant());

		assertThat(orchestrator.getSubscription(sub.getSubscriptionId()).getStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
	}

	@Test
	void tick_repeatedDeclines_followDunningScheduleThenCancel() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.failed(null, "insufficient_funds"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();

		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.FAILED);
		Subscription pastDue = orchestrator.getSubscription(id);
		assertThat(pastDue.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
		assertThat(pastDue.getNextRetryAt()).isEqualTo(clock.instant().plus(Duration.ofDays(1)));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.NOT_DUE);

		clock.advance(Duration.ofDays(1));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.FAILED);
		assertThat(orchestrator.getSubscription(id).getNextRetryAt()).isEqualTo(clock.instant().plus(Duration.ofDays(3)));

		clock.advance(Duration.ofDays(3));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.FAILED);
		assertThat(orchestrator.getSubscription(id).getNextRetryAt()).isEqualTo(clock.instant().plus(Duration.ofDays(7)));

		clock.advance(Duration.ofDays(7));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.CANCELLED);

		Subscription cancelled = orchestrator.getSubscription(id);
		assertThat(cancelled.getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
		assertThat(cancelled.getFailedAttemptCount()).isEqualTo(4);
		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.VOID);
		assertThat(orchestrator.getChargeAttempts(id))
			.extracting(ChargeAttempt::getAttemptNumber).containsExactly(1, 2, 3, 4);
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.NOT_DUE);
	}

	@Test
	void tick_permanentProviderRejection_countsAsDecline() {
		when(gateway.initiateCharge(any()))
			.thenThrow(ProviderException.permanentFailure(PaymentProvider.CARD, "card_expired", "expired"));
		Subscription sub = subscribe(null);

		assertThat(orchestrator.tick(sub.getSubscriptionId(), clock.instant())).isEqualTo(TickResult.FAILED);
		assertThat(orchestrator.getChargeAttempts(sub.getSubscriptionId()).get(0).getFailureCode()).isEqualTo("card_expired");
	}

	@Test
	void tick_transientError_resendsWithSameAttemptId() {
		when(gateway.initiateCharge(any()))
			.thenThrow(ProviderException.transientFailure(PaymentProvider.CARD, "timeout", null))
			.thenThrow(ProviderException.transientFailure(PaymentProvider.CARD, "timeout", null))
			.thenThrow(ProviderException.transientFailure(PaymentProvider.CARD, "timeout", null))
			.thenReturn(ChargeResult.settled("ch_after_timeout"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();

		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.TRANSIENT_ERROR);
		Subscription waiting = orchestrator.getSubscription(id);
		assertThat(waiting.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
		assertThat(waiting.getNextRetryAt()).isAfter(clock.instant());
		assertThat(orchestrator.getChargeAttempts(id))
			.extracting(ChargeAttempt::getStatus).containsExactly(ChargeAttemptStatus.ERROR);

		clock.advance(Duration.ofHours(2));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.PAID);

		ArgumentCaptor<ChargeRequest> requests = ArgumentCaptor.forClass(ChargeRequest.class);
		verify(gateway, times(4)).initiateCharge(requests.capture());
		assertThat(requests.getAllValues()).extracting(ChargeRequest::getAttemptId).containsOnly(
			requests.getAllValues().get(0).getAttemptId());
		assertThat(orchestrator.getChargeAttempts(id)).hasSize(1);
	}

	@Test
	void pendingCharge_settledByProviderEvent_renewsSubscription() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.pending("ch_async"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();

		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.PENDING);
		assertThat(orchestrator.getSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.RENEWAL_PENDING);

		Instant now = clock.instant();
		paymentIngestion.ingest(PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, "ch_async")
			.amount(Money.ofMinor(999, CurrencyCode.EUR))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.subjectRef(SubjectRef.subscription(id))
			.createdAt(now)
			.settledAt(now)
			.build());

		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.PAID);
		assertThat(orchestrator.getSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
		assertThat(orchestrator.getSubscription(id).getCompletedCycles()).isEqualTo(1);
	}

	@Test
	void replayedSettlement_appliesDownstreamOnce() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.pending("ch_replayed"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();
		Instant start = clock.instant();
		orchestrator.tick(id, clock.instant());

		assertThat(settleAsync(id, "ch_replayed").getOutcome()).isEqualTo(IngestResult.Outcome.INSERTED);
		assertThat(settleAsync(id, "ch_replayed").getOutcome()).isEqualTo(IngestResult.Outcome.DUPLICATE);

		Subscription renewed = orchestrator.getSubscription(id);
		assertThat(renewed.getCompletedCycles()).isEqualTo(1);
		assertThat(renewed.getCurrentPeriodEnd()).isEqualTo(BillingFrequency.MONTHLY.next(start));
		assertThat(auditRows("INVOICE", "PAID")).isEqualTo(1);
		assertThat(auditRows("SUBSCRIPTION", "RENEWED")).isEqualTo(1);
	}

	// ============ Lifecycle ============

	@Test
	void pauseAndResume_controlWhetherTicksCharge() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.settled("ch_1"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();

		assertThat(orchestrator.pauseSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.PAUSED);
		assertThat(orchestrator.pauseSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.PAUSED);
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.NOT_DUE);

		assertThat(orchestrator.resumeSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.PAID);
	}

	@Test
	void cancel_isFinalAndVoidsOpenInvoices() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.failed(null, "declined"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();
		orchestrator.tick(id, clock.instant());

		assertThat(orchestrator.cancelSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
		assertThat(orchestrator.cancelSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.VOID);
		assertThatThrownBy(() -> orchestrator.resumeSubscription(id)).isInstanceOf(InvalidStateTransitionException.class);
		assertThatThrownBy(() -> orchestrator.pauseSubscription(id)).isInstanceOf(InvalidStateTransitionException.class);
	}

	@Test
	void pauseWhileChargePending_settlementPaysInvoiceAndStaysPaused() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.pending("ch_paused"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.PENDING);

		assertThat(orchestrator.pauseSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.PAUSED);
		settleAsync(id, "ch_paused");

		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.PAID);
		Subscription paused = orchestrator.getSubscription(id);
		assertThat(paused.getStatus()).isEqualTo(SubscriptionStatus.PAUSED);
		assertThat(paused.getCompletedCycles()).isEqualTo(1);
		assertThat(orchestrator.getChargeAttempts(id))
			.extracting(ChargeAttempt::getStatus).containsExactly(ChargeAttemptStatus.SETTLED);

		clock.advance(Duration.ofDays(62));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.NOT_DUE);
		verify(gateway, times(1)).initiateCharge(any());
	}

	@Test
	void cancelWhileChargePending_settlementPaysInvoiceAndStaysCancelled() {
		when(gateway.initiateCharge(any())).thenReturn(ChargeResult.pending("ch_cancelled"));
		Subscription sub = subscribe(null);
		UUID id = sub.getSubscriptionId();
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.PENDING);

		assertThat(orchestrator.cancelSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);
		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.ISSUED);
		settleAsync(id, "ch_cancelled");

		assertThat(onlyInvoice().getStatus()).isEqualTo(InvoiceStatus.PAID);
		assertThat(orchestrator.getSubscription(id).getStatus()).isEqualTo(SubscriptionStatus.CANCELLED);

		clock.advance(Duration.ofDays(62));
		assertThat(orchestrator.tick(id, clock.instant())).isEqualTo(TickResult.NOT_DUE);
		verify(gateway, times(1)).initiateCharge(any());
	}
}
