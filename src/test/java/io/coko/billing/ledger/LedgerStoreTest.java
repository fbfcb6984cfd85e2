package io.coko.billing.ledger;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerStoreTest extends AbstractIntegrationTest {

	@Autowired
	private LedgerStore ledger;

	private static PaymentTransaction.Builder tx(String providerTxnId, long minor, TransactionKind kind,
			TransactionStatus status, SubjectRef subject) {
		Instant at = Instant.parse("2025-01-10T10:00:00Z");
		return PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, providerTxnId)
			.amount(Money.ofMinor(minor, CurrencyCode.EUR))
			.kind(kind)
			.status(status)
			.subjectRef(subject)
			.createdAt(at)
			.settledAt(status == TransactionStatus.FAILED ? null : at);
	}

	@Test
	void ingest_sameExternalRefTwice_secondIsDuplicate() {
		SubjectRef invoice = SubjectRef.invoice(UUID.randomUUID());
		PaymentTransaction first = tx("ch_dup", 1000, TransactionKind.CHARGE, TransactionStatus.SETTLED, invoice).build();
		PaymentTransaction replay = tx("ch_dup", 1000, TransactionKind.CHARGE, TransactionStatus.SETTLED, invoice).build();

		assertThat(ledger.ingest(first)).isEqualTo(IngestOutcome.INSERTED);
		assertThat(ledger.ingest(replay)).isEqualTo(IngestOutcome.DUPLICATE);
		assertThat(ledger.findByExternalRef(replay.getExternalRef()))
			.get().extracting(PaymentTransaction::getId).isEqualTo(first.getId());
	}

	@Test
	void ingest_concurrentDeliveriesOfOneEvent_insertExactlyOnce() throws Exception {
		int threads = 16;
		SubjectRef invoice = SubjectRef.invoice(UUID.randomUUID());
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		CountDownLatch ready = new CountDownLatch(threads);
		CountDownLatch go = new CountDownLatch(1);
		List<Future<IngestOutcome>> outcomes = new ArrayList<>();
		try {
			for (int i = 0; i < threads; i++) {
				outcomes.add(pool.submit(() -> {
					PaymentTransaction delivery = tx("ch_race", 1000, TransactionKind.CHARGE, TransactionStatus.SETTLED, invoice)
						.build();
					ready.countDown();
					go.await();
					return ledger.ingest(delivery);
				}));
			}
			assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
			go.countDown();

			List<IngestOutcome> results = new ArrayList<>();
			for (Future<IngestOutcome> outcome : outcomes) {
				results.add(outcome.get(30, TimeUnit.SECONDS));
			}
			assertThat(results).filteredOn(o -> o == IngestOutcome.INSERTED).hasSize(1);
			assertThat(results).filteredOn(o -> o == IngestOutcome.DUPLICATE).hasSize(threads - 1);
		} finally {
			pool.shutdownNow();
		}

		Integer rows = jdbc.queryForObject(
			"SELECT COUNT(1) FROM payment_transaction WHERE provider_transaction_id = 'ch_race'", Integer.class);
		assertThat(rows).isEqualTo(1);
		assertThat(ledger.sumApplied(invoice, CurrencyCode.EUR)).isEqualTo(Money.ofMinor(1000, CurrencyCode.EUR));
	}

	@Test
	void ingest_sameIdAtOtherProvider_isDistinct() {
		PaymentTransaction card = tx("shared-id", 100, TransactionKind.CHARGE, TransactionStatus.SETTLED, null).build();
		PaymentTransaction orange = tx("shared-id", 100, TransactionKind.CHARGE, TransactionStatus.SETTLED, null)
			.externalRef(PaymentProvider.ORANGE_MONEY, "shared-id")
			.build();

		assertThat(ledger.ingest(card)).isEqualTo(IngestOutcome.INSERTED);
		assertThat(ledger.ingest(orange)).isEqualTo(IngestOutcome.INSERTED);
	}

	@Test
	void sumApplied_netsRefundsAndIgnoresFailures() {
		SubjectRef invoice = SubjectRef.invoice(UUID.randomUUID());
		ledger.ingest(tx("ch_1", 1500, TransactionKind.CHARGE, TransactionStatus.SETTLED, invoice).build());
		ledger.ingest(tx("ch_2", 900, TransactionKind.CHARGE, TransactionStatus.FAILED, invoice).failureCode("declined").build());
		ledger.ingest(tx("re_1", 400, TransactionKind.REFUND, TransactionStatus.SETTLED, invoice)
			.relatedProviderTransactionId("ch_1").build());
		ledger.ingest(tx("ch_other", 700, TransactionKind.CHARGE, TransactionStatus.SETTLED,
			SubjectRef.invoice(UUID.randomUUID())).build());

		assertThat(ledger.sumApplied(invoice, CurrencyCode.EUR)).isEqualTo(Money.ofMinor(1100, CurrencyCode.EUR));
		assertThat(ledger.sumApplied(invoice, CurrencyCode.XOF)).isEqualTo(Money.zero(CurrencyCode.XOF));
	}

	@Test
	void query_byAuthorAndSettledWindow() {
		ledger.ingest(tx("ch_a1", 100, TransactionKind.CHARGE, TransactionStatus.SETTLED, null).authorRef("a-1").build());
		ledger.ingest(tx("ch_a2", 200, TransactionKind.CHARGE, TransactionStatus.SETTLED, null).authorRef("a-2").build());
		ledger.ingest(tx("ch_late", 300, TransactionKind.CHARGE, TransactionStatus.SETTLED, null).authorRef("a-1")
			.settledAt(Instant.parse("2025-02-01T00:00:00Z")).build());

		List<PaymentTransaction> january = ledger.query(LedgerQuery.create()
			.author("a-1")
			.settledBetween(Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-02-01T00:00:00Z")));

		assertThat(january).extracting(PaymentTransaction::getProviderTransactionId).containsExactly("ch_a1");
		assertThat(ledger.distinctAuthors(Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-02-01T00:00:00Z")))
			.containsExactlyInAnyOrder("a-1", "a-2");
	}
}
