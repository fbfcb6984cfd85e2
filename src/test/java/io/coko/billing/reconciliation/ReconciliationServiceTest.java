package io.coko.billing.reconciliation;

import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.ItemType;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.royalty.AuthorRoyalty;
import io.coko.billing.royalty.RoyaltyCalculator;
import io.coko.billing.royalty.RoyaltyPeriod;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationServiceTest extends AbstractIntegrationTest {

	@Autowired
	private ReconciliationService reconciliationService;

	@Autowired
	private InvoiceManager invoiceManager;

	@Autowired
	private RoyaltyCalculator royaltyCalculator;

	@Autowired
	private LedgerStore ledger;

	private PaymentTransaction.Builder settled(String providerTxnId, TransactionKind kind, long minor) {
		Instant now = clock.instant();
		return PaymentTransaction.builder()
			.id(UUID.randomUUID())
			.externalRef(PaymentProvider.CARD, providerTxnId)
			.amount(Money.ofMinor(minor, CurrencyCode.EUR))
			.kind(kind)
			.status(TransactionStatus.SETTLED)
			.createdAt(now)
			.settledAt(now);
	}

	private static List<?> variances(Map<String, Object> report) {
		return (List<?>) report.get("paidInvoiceVariances");
	}

	@Test
	void dailyReport_flagsOnlyPaidInvoicesThatFallShort() {
		// paid by charges, then partly refunded
		Invoice refunded = invoiceManager.createInvoice("reader-1",
			List.of(new InvoiceItem("Ebook", 1, Money.ofMinor(1000, CurrencyCode.EUR), ItemType.BOOK_PURCHASE)),
			CurrencyCode.EUR);
		ledger.ingest(settled("ch_full", TransactionKind.CHARGE, 1000).subjectRef(SubjectRef.invoice(refunded.getInvoiceId())).build());
		invoiceManager.applyPayment(refunded.getInvoiceId(), null);
		ledger.ingest(settled("re_part", TransactionKind.REFUND, 300).subjectRef(SubjectRef.invoice(refunded.getInvoiceId()))
			.relatedProviderTransactionId("ch_full").build());

		// standalone purchase invoiced after the fact
		PaymentTransaction purchase = settled("ch_solo", TransactionKind.CHARGE, 8000)
			.payerRef("reader-2")
			.authorRef("author-1")
			.revenueStream(RevenueStream.DIRECT_SALE)
			.build();
		ledger.ingest(purchase);
		invoiceManager.createInvoiceFromTransaction(purchase);

		// royalty invoice settled by its payout
		RoyaltyPeriod january = RoyaltyPeriod.ofMonth(YearMonth.of(2025, 1));
		AuthorRoyalty royalty = royaltyCalculator.computeAuthorRoyalties("author-1", january).get(0);
		assertThat(royaltyCalculator.invoiceRoyalties("author-1", january)).hasSize(1);
		royaltyCalculator.markPaid(royalty.getRoyaltyId(), PaymentProvider.ORANGE_MONEY, "po_recon");

		Map<String, Object> report = reconciliationService.generateDailyReconciliation(LocalDate.of(2025, 1, 1), "test");

		assertThat(variances(report)).hasSize(1);
		Map<?, ?> variance = (Map<?, ?>) variances(report).get(0);
		assertThat(String.valueOf(variance.get("invoice_id"))).isEqualTo(refunded.getInvoiceId().toString());
		assertThat(((Number) variance.get("applied_minor")).longValue()).isEqualTo(700L);
	}
}
