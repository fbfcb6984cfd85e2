package io.coko.billing.batch;

import io.coko.billing.gateway.ChargeResult;
import io.coko.billing.gateway.PaymentGateway;
import io.coko.billing.gateway.PaymentGatewayRegistry;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.subscription.BillingFrequency;
import io.coko.billing.subscription.RecurringBillingOrchestrator;
import io.coko.billing.subscription.Subscription;
import io.coko.billing.subscription.SubscriptionRequest;
import io.coko.billing.subscription.SubscriptionStatus;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;

class RenewalJobTest extends AbstractIntegrationTest {

	@MockBean
	private PaymentGatewayRegistry gatewayRegistry;

	@Autowired
	private RenewalJobLauncher launcher;

	@Autowired
	private BillingRunRepository runRepository;

	@Autowired
	private RecurringBillingOrchestrator orchestrator;

	@BeforeEach
	void stubGateway() {
		PaymentGateway gateway = Mockito.mock(PaymentGateway.class);
		Mockito.when(gateway.provider()).thenReturn(PaymentProvider.CARD);
		Mockito.when(gateway.initiateCharge(argThat(r -> r != null && "pm_ok".equals(r.getPaymentMethodRef()))))
			.thenReturn(ChargeResult.settled("ch_" + UUID.randomUUID()));
		Mockito.when(gateway.initiateCharge(argThat(r -> r != null && "pm_declined".equals(r.getPaymentMethodRef()))))
			.thenReturn(ChargeResult.failed(null, "insufficient_funds"));
		Mockito.when(gatewayRegistry.get(PaymentProvider.CARD)).thenReturn(gateway);
	}

	private Subscription subscribe(String userRef, String paymentMethodRef) {
		SubscriptionRequest request = new SubscriptionRequest();
		request.setUserRef(userRef);
		request.setPlanCode("premium");
		request.setPrice(Money.ofMinor(999, CurrencyCode.EUR));
		request.setFrequency(BillingFrequency.MONTHLY);
		request.setProvider(PaymentProvider.CARD);
		request.setPaymentMethodRef(paymentMethodRef);
		return orchestrator.createSubscription(request);
	}

	private static Map<String, Long> counts(List<Map<String, Object>> rows) {
		Map<String, Long> counts = new HashMap<>();
		rows.forEach(row -> counts.put(String.valueOf(row.get("result")), ((Number) row.get("cnt")).longValue()));
		return counts;
	}

	@Test
	void renewalRun_ticksDueSubscriptionsAndRecordsItems() {
		Subscription good = subscribe("reader-1", "pm_ok");
		Subscription declined = subscribe("reader-2", "pm_declined");

		JobExecution exec = launcher.launch(clock.instant(), "test", "corr-" + UUID.randomUUID());

		assertThat(exec.getStatus()).isEqualTo(BatchStatus.COMPLETED);
		String runId = RenewalJobLauncher.billingRunId(exec);
		assertThat(runId).isNotNull();

		Map<String, Object> run = runRepository.findRun(UUID.fromString(runId)).orElseThrow();
		assertThat(run.get("status")).isEqualTo("COMPLETED");
		assertThat(counts(runRepository.countsByResult(UUID.fromString(runId))))
			.containsEntry("PAID", 1L)
			.containsEntry("FAILED", 1L);
		assertThat(runRepository.items(UUID.fromString(runId), 10)).hasSize(2);

		assertThat(orchestrator.getSubscription(good.getSubscriptionId()).getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
		assertThat(orchestrator.getSubscription(declined.getSubscriptionId()).getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
	}

	@Test
	void renewalRun_nothingDue_completesEmpty() {
		subscribe("reader-1", "pm_ok");
		launcher.launch(clock.instant(), "test", "corr-" + UUID.randomUUID());

		// Period already advanced, so the second run finds nothing
		JobExecution second = launcher.launch(clock.instant(), "test", "corr-" + UUID.randomUUID());

		assertThat(second.getStatus()).isEqualTo(BatchStatus.COMPLETED);
		UUID runId = UUID.fromString(RenewalJobLauncher.billingRunId(second));
		assertThat(runRepository.countsByResult(runId)).isEmpty();
		assertThat(runRepository.recentRuns(10)).hasSize(2);
	}
}
