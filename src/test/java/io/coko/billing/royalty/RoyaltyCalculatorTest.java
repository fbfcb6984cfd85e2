package io.coko.billing.royalty;

import io.coko.billing.configstore.ConfigType;
import io.coko.billing.configstore.ConfigValue;
import io.coko.billing.exception.ImmutablePeriodException;
import io.coko.billing.exception.InvalidStateTransitionException;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.InvoiceStatus;
import io.coko.billing.invoice.ItemType;
import io.coko.billing.ledger.LedgerQuery;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoyaltyCalculatorTest extends AbstractIntegrationTest {

	private static final RoyaltyPeriod JANUARY = RoyaltyPeriod.ofMonth(YearMonth.of(2025, 1));
	private static final RoyaltyPeriod FEBRUARY = RoyaltyPeriod.ofMonth(YearMonth.of(2025, 2));

	@Autowired
	private RoyaltyCalculator calculator;

	@Autowired
	private LedgerStore ledger;

	@Autowired
	private InvoiceManager invoiceManager;

	private void record(String providerTxnId, TransactionKind kind, long minor, String settledAt) {
		Instant at = Instant.parse(settledAt);
		PaymentTransaction.Builder builder = PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, providerTxnId)
			.amount(Money.ofMinor(minor, CurrencyCode.EUR))
			.kind(kind)
			.status(TransactionStatus.SETTLED)
			.authorRef("author-1")
			.revenueStream(RevenueStream.DIRECT_SALE)
			.createdAt(at)
			.settledAt(at);
		if (kind == TransactionKind.REFUND) {
			builder.relatedProviderTransactionId("ch_1");
		}
		ledger.ingest(builder.build());
	}

	private static Money eur(long minor) {
		return Money.ofMinor(minor, CurrencyCode.EUR);
	}

	// ============ Computation ============

	@Test
	void compute_netsRefundsAtConfiguredRate() {
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-05T10:00:00Z");
		record("ch_2", TransactionKind.CHARGE, 500, "2025-01-12T10:00:00Z");
		record("re_1", TransactionKind.REFUND, 200, "2025-01-20T10:00:00Z");
		record("ch_feb", TransactionKind.CHARGE, 9999, "2025-02-01T00:00:00Z");

		List<AuthorRoyalty> records = calculator.computeRoyalties(JANUARY);

		assertThat(records).hasSize(1);
		AuthorRoyalty royalty = records.get(0);
		assertThat(royalty.getAuthorRef()).isEqualTo("author-1");
		assertThat(royalty.getGrossBase()).isEqualTo(eur(1300));
		assertThat(royalty.getPayable()).isEqualTo(eur(910));
		assertThat(royalty.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);
		assertThat(royalty.getSourceTransactionIds()).hasSize(3);
	}

	@Test
	void compute_rateChangeMidPeriod_appliesRateInEffectAtSettlement() {
		configService.setConfig(ConfigType.ROYALTY_RATE, "DIRECT_SALE", ConfigValue.decimal(new BigDecimal("0.80")),
			Instant.parse("2025-01-15T00:00:00Z"), "ops");
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-10T10:00:00Z");
		record("ch_2", TransactionKind.CHARGE, 1000, "2025-01-20T10:00:00Z");

		AuthorRoyalty royalty = calculator.computeAuthorRoyalties("author-1", JANUARY).get(0);

		assertThat(royalty.getPayable()).isEqualTo(eur(1500));
	}

	@Test
	void compute_twice_updatesSameRecord() {
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-05T10:00:00Z");
		AuthorRoyalty first = calculator.computeAuthorRoyalties("author-1", JANUARY).get(0);

		record("ch_2", TransactionKind.CHARGE, 1000, "2025-01-06T10:00:00Z");
		AuthorRoyalty second = calculator.computeAuthorRoyalties("author-1", JANUARY).get(0);

		assertThat(second.getRoyaltyId()).isEqualTo(first.getRoyaltyId());
		assertThat(second.getPayable()).isEqualTo(eur(1400));
		assertThat(calculator.getRoyaltySummary("author-1", JANUARY).getRecords()).hasSize(1);
	}

	@Test
	void compute_belowThreshold_carriesIntoNextPeriod() {
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-05T10:00:00Z");
		AuthorRoyalty january = calculator.computeRoyalties(JANUARY).get(0);
		record("ch_2", TransactionKind.CHARGE, 6000, "2025-02-05T10:00:00Z");

		AuthorRoyalty february = calculator.computeRoyalties(FEBRUARY).get(0);

		assertThat(january.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);
		assertThat(february.getPayable()).isEqualTo(eur(4200));
		assertThat(february.getCarried()).isEqualTo(eur(700));
		assertThat(february.getTotalDue()).isEqualTo(eur(4900));
		assertThat(february.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);

		record("ch_3", TransactionKind.CHARGE, 200, "2025-02-06T10:00:00Z");
		AuthorRoyalty recomputed = calculator.computeRoyalties(FEBRUARY).get(0);

		assertThat(recomputed.getTotalDue()).isEqualTo(eur(5040));
		assertThat(recomputed.getStatus()).isEqualTo(RoyaltyStatus.PAYABLE);
		assertThat(calculator.getRoyalty(january.getRoyaltyId()).getCarriedInto()).isEqualTo(recomputed.getRoyaltyId());
	}

	@Test
	void compute_thresholdEffectiveAtPeriodEnd_appliesFromNextPeriodOnly() {
		configService.setConfig(ConfigType.PAYOUT_THRESHOLD, "EUR", ConfigValue.money(eur(500)),
			Instant.parse("2025-02-01T00:00:00Z"), "ops");
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-05T10:00:00Z");

		AuthorRoyalty january = calculator.computeRoyalties(JANUARY).get(0);

		assertThat(january.getTotalDue()).isEqualTo(eur(700));
		assertThat(january.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);

		record("ch_2", TransactionKind.CHARGE, 100, "2025-02-03T10:00:00Z");
		AuthorRoyalty february = calculator.computeRoyalties(FEBRUARY).get(0);

		assertThat(february.getTotalDue()).isEqualTo(eur(770));
		assertThat(february.getStatus()).isEqualTo(RoyaltyStatus.PAYABLE);
	}

	// ============ Payout ============

	@Test
	void markPaid_recordsPayoutAndIsIdempotent() {
		record("ch_1", TransactionKind.CHARGE, 10000, "2025-01-05T10:00:00Z");
		AuthorRoyalty royalty = calculator.computeRoyalties(JANUARY).get(0);
		assertThat(royalty.getStatus()).isEqualTo(RoyaltyStatus.PAYABLE);

		AuthorRoyalty paid = calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.ORANGE_MONEY, "po_1");
		AuthorRoyalty again = calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.ORANGE_MONEY, "po_1");

		assertThat(paid.getStatus()).isEqualTo(RoyaltyStatus.PAID);
		assertThat(again.getPayoutTransactionId()).isEqualTo(paid.getPayoutTransactionId());
		PaymentTransaction payout = ledger.findById(paid.getPayoutTransactionId()).orElseThrow();
		assertThat(payout.getKind()).isEqualTo(TransactionKind.PAYOUT);
		assertThat(payout.getAmount()).isEqualTo(eur(7000));
		assertThat(payout.getAuthorRef()).isEqualTo("author-1");
	}

	@Test
	void markPaid_secondPayoutReference_isConflict() {
		record("ch_1", TransactionKind.CHARGE, 10000, "2025-01-05T10:00:00Z");
		AuthorRoyalty royalty = calculator.computeRoyalties(JANUARY).get(0);
		calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.CARD, "po_1");

		assertThatThrownBy(() -> calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.CARD, "po_2"))
			.isInstanceOf(InvalidStateTransitionException.class);
	}

	@Test
	void markPaid_accruedRecord_isConflict() {
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-05T10:00:00Z");
		AuthorRoyalty royalty = calculator.computeRoyalties(JANUARY).get(0);

		assertThatThrownBy(() -> calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.CARD, "po_1"))
			.isInstanceOf(InvalidStateTransitionException.class);
	}

	// ============ Paid periods ============

	@Test
	void compute_paidPeriod_isImmutable() {
		record("ch_1", TransactionKind.CHARGE, 10000, "2025-01-05T10:00:00Z");
		AuthorRoyalty royalty = calculator.computeRoyalties(JANUARY).get(0);
		calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.CARD, "po_1");

		assertThatThrownBy(() -> calculator.computeRoyalties(JANUARY)).isInstanceOf(ImmutablePeriodException.class);
		assertThatThrownBy(() -> calculator.computeAuthorRoyalties("author-1", JANUARY))
			.isInstanceOf(ImmutablePeriodException.class);
	}

	@Test
	void appendCorrections_lateRefundOnPaidPeriod_appendsNegativeDelta() {
		record("ch_1", TransactionKind.CHARGE, 10000, "2025-01-05T10:00:00Z");
		AuthorRoyalty original = calculator.computeRoyalties(JANUARY).get(0);
		calculator.markPaid(original.getRoyaltyId(), PaymentProvider.CARD, "po_1");
		record("re_late", TransactionKind.REFUND, 1000, "2025-01-28T10:00:00Z");

		List<AuthorRoyalty> corrections = calculator.appendCorrections(JANUARY);

		assertThat(corrections).hasSize(1);
		AuthorRoyalty correction = corrections.get(0);
		assertThat(correction.getCorrectionOf()).isEqualTo(original.getRoyaltyId());
		assertThat(correction.getPayable()).isEqualTo(eur(-700));
		assertThat(correction.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);
		assertThat(calculator.getRoyalty(original.getRoyaltyId()).getPayable()).isEqualTo(eur(7000));
		assertThat(calculator.appendCorrections(JANUARY)).isEmpty();
	}

	// ============ Carried-forward periods ============

	@Test
	void compute_carriedForwardPeriod_isImmutable() {
		record("ch_jan", TransactionKind.CHARGE, 4000, "2025-01-10T10:00:00Z");
		calculator.computeRoyalties(JANUARY);
		record("ch_feb", TransactionKind.CHARGE, 4000, "2025-02-10T10:00:00Z");
		calculator.computeRoyalties(FEBRUARY);

		assertThatThrownBy(() -> calculator.computeRoyalties(JANUARY)).isInstanceOf(ImmutablePeriodException.class);
		assertThatThrownBy(() -> calculator.computeAuthorRoyalties("author-1", JANUARY))
			.isInstanceOf(ImmutablePeriodException.class);
	}

	@Test
	void lateChargeOnCarriedForwardPeriod_isPaidOutExactlyOnce() {
		record("ch_jan", TransactionKind.CHARGE, 4000, "2025-01-10T10:00:00Z");
		AuthorRoyalty january = calculator.computeRoyalties(JANUARY).get(0);
		assertThat(january.getTotalDue()).isEqualTo(eur(2800));
		assertThat(january.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);

		record("ch_feb", TransactionKind.CHARGE, 4000, "2025-02-10T10:00:00Z");
		AuthorRoyalty february = calculator.computeRoyalties(FEBRUARY).get(0);
		assertThat(february.getCarried()).isEqualTo(eur(2800));
		assertThat(february.getStatus()).isEqualTo(RoyaltyStatus.PAYABLE);

		record("ch_jan_late", TransactionKind.CHARGE, 4000, "2025-01-30T10:00:00Z");

		assertThatThrownBy(() -> calculator.computeRoyalties(JANUARY)).isInstanceOf(ImmutablePeriodException.class);
		List<AuthorRoyalty> corrections = calculator.appendCorrections(JANUARY);

		assertThat(corrections).hasSize(1);
		assertThat(corrections.get(0).getCorrectionOf()).isEqualTo(january.getRoyaltyId());
		assertThat(corrections.get(0).getPayable()).isEqualTo(eur(2800));

		AuthorRoyalty recomputed = calculator.computeRoyalties(FEBRUARY).get(0);
		assertThat(recomputed.getRoyaltyId()).isEqualTo(february.getRoyaltyId());
		assertThat(recomputed.getTotalDue()).isEqualTo(eur(8400));

		calculator.markPaid(recomputed.getRoyaltyId(), PaymentProvider.CARD, "po_feb");

		Money paidOut = ledger.query(LedgerQuery.create().author("author-1").kinds(TransactionKind.PAYOUT)).stream()
			.map(PaymentTransaction::getAmount)
			.reduce(eur(0), Money::add);
		assertThat(paidOut).isEqualTo(eur(8400));
		AuthorRoyalty originalJanuary = calculator.getRoyalty(january.getRoyaltyId());
		assertThat(originalJanuary.getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);
		assertThat(originalJanuary.getPayable()).isEqualTo(eur(2800));
		assertThat(calculator.appendCorrections(JANUARY)).isEmpty();
	}

	// ============ Royalty invoices ============

	@Test
	void invoiceRoyalties_issuesInvoiceThatPayoutSettles() {
		record("ch_1", TransactionKind.CHARGE, 10000, "2025-01-05T10:00:00Z");
		AuthorRoyalty royalty = calculator.computeRoyalties(JANUARY).get(0);

		List<Invoice> invoices = calculator.invoiceRoyalties("author-1", JANUARY);

		assertThat(invoices).hasSize(1);
		Invoice invoice = invoices.get(0);
		assertThat(invoice.getUserRef()).isEqualTo("author-1");
		assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.ISSUED);
		assertThat(invoice.getStoredTotal()).isEqualTo(eur(7000));
		assertThat(invoice.getItems()).hasSize(1);
		assertThat(invoice.getItems().get(0).getItemType()).isEqualTo(ItemType.ROYALTY);

		AuthorRoyalty invoiced = calculator.getRoyalty(royalty.getRoyaltyId());
		assertThat(invoiced.getStatus()).isEqualTo(RoyaltyStatus.INVOICED);
		assertThat(invoiced.getInvoiceId()).isEqualTo(invoice.getInvoiceId());
		assertThat(calculator.invoiceRoyalties("author-1", JANUARY)).isEmpty();
		assertThatThrownBy(() -> calculator.computeRoyalties(JANUARY)).isInstanceOf(ImmutablePeriodException.class);

		AuthorRoyalty paid = calculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.ORANGE_MONEY, "po_1");

		assertThat(paid.getStatus()).isEqualTo(RoyaltyStatus.PAID);
		assertThat(invoiceManager.getInvoice(invoice.getInvoiceId()).getStatus()).isEqualTo(InvoiceStatus.PAID);
		PaymentTransaction payout = ledger.findById(paid.getPayoutTransactionId()).orElseThrow();
		assertThat(payout.getSubjectRef()).isEqualTo(SubjectRef.invoice(invoice.getInvoiceId()));
	}

	@Test
	void invoiceRoyalties_accruedRecordsAreNotInvoiced() {
		record("ch_1", TransactionKind.CHARGE, 1000, "2025-01-05T10:00:00Z");
		AuthorRoyalty royalty = calculator.computeRoyalties(JANUARY).get(0);

		assertThat(calculator.invoiceRoyalties("author-1", JANUARY)).isEmpty();
		assertThat(calculator.getRoyalty(royalty.getRoyaltyId()).getStatus()).isEqualTo(RoyaltyStatus.ACCRUED);
	}
}
