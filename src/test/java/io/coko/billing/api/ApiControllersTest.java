package io.coko.billing.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.ratelimit.BillingRateLimiter;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST surface for invoices, subscriptions, configuration and royalties against the in-memory database.
 */
@AutoConfigureMockMvc(addFilters = false)
class ApiControllersTest extends AbstractIntegrationTest {

	@Autowired
	private MockMvc mvc;

	@Autowired
	private ObjectMapper om;

	@Autowired
	private LedgerStore ledger;

	@Autowired
	private InvoiceManager invoiceManager;

	@MockBean
	private BillingRateLimiter rateLimiter;

	@BeforeEach
	void allowTraffic() {
		Mockito.when(rateLimiter.tryConsumeApi()).thenReturn(true);
		Mockito.when(rateLimiter.tryConsumeJobLaunch()).thenReturn(true);
	}

	private static final String INVOICE_BODY = """
		{
		  "userRef": "reader-42",
		  "currency": "EUR",
		  "items": [
		    {"description": "Ebook", "quantity": 2, "unitPriceMinor": 650, "itemType": "BOOK_PURCHASE", "authorRef": "author-7"},
		    {"description": "Tip", "quantity": 1, "unitPriceMinor": 200, "itemType": "TIP", "authorRef": "author-7"}
		  ]
		}
		""";

	private JsonNode json(MvcResult result) throws Exception {
		return om.readTree(result.getResponse().getContentAsString());
	}

	private UUID createInvoice() throws Exception {
		MvcResult result = mvc.perform(post("/api/invoices")
				.contentType(MediaType.APPLICATION_JSON)
				.content(INVOICE_BODY))
			.andExpect(status().isCreated())
			.andReturn();
		return UUID.fromString(json(result).get("invoiceId").asText());
	}

	// ============ Invoices ============

	@Test
	void postInvoice_should201WithNumberAndTotal() throws Exception {
		mvc.perform(post("/api/invoices")
				.contentType(MediaType.APPLICATION_JSON)
				.content(INVOICE_BODY))
			.andExpect(status().isCreated())
			.andExpect(jsonPath("$.invoiceNumber").value("COKO-000001"))
			.andExpect(jsonPath("$.status").value("ISSUED"))
			.andExpect(jsonPath("$.total.amountMinorUnits").value(1500))
			.andExpect(jsonPath("$.total.currency").value("EUR"))
			.andExpect(jsonPath("$.items", hasSize(2)));
	}

	@Test
	void getInvoice_andListByUser_should200() throws Exception {
		UUID invoiceId = createInvoice();

		mvc.perform(get("/api/invoices/" + invoiceId))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.invoiceId").value(invoiceId.toString()))
			.andExpect(jsonPath("$.userRef").value("reader-42"));

		mvc.perform(get("/api/invoices").param("userRef", "reader-42"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$", hasSize(1)));
	}

	@Test
	void postInvoice_unsupportedCurrency_should400() throws Exception {
		mvc.perform(post("/api/invoices")
				.contentType(MediaType.APPLICATION_JSON)
				.content(INVOICE_BODY.replace("\"EUR\"", "\"GBP\"")))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.error").value("validation_failed"))
			.andExpect(jsonPath("$.details.field").value("currency"));
	}

	@Test
	void getInvoice_badIdOrUnknownId() throws Exception {
		mvc.perform(get("/api/invoices/not-a-uuid"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.details.field").value("invoiceId"));

		mvc.perform(get("/api/invoices/" + UUID.randomUUID()))
			.andExpect(status().isNotFound())
			.andExpect(jsonPath("$.error").value("not_found"));
	}

	@Test
	void voidInvoice_openThenPaid() throws Exception {
		UUID open = createInvoice();
		mvc.perform(post("/api/invoices/" + open + "/void")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"reason\":\"customer_request\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("VOID"))
			.andExpect(jsonPath("$.voidReason").value("customer_request"));

		UUID paid = createInvoice();
		Instant now = clock.instant();
		ledger.ingest(PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, "ch_api_1")
			.amount(Money.ofMinor(1500, CurrencyCode.EUR))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.subjectRef(SubjectRef.invoice(paid))
			.createdAt(now)
			.settledAt(now)
			.build());
		invoiceManager.applyPayment(paid, null);

		mvc.perform(post("/api/invoices/" + paid + "/void"))
			.andExpect(status().isConflict())
			.andExpect(jsonPath("$.error").value("conflict"));
	}

	@Test
	void postInvoice_withDiscount_thenStatistics() throws Exception {
		String discounted = INVOICE_BODY.replace("\"currency\": \"EUR\",", "\"currency\": \"EUR\", \"discountMinor\": 300,");
		mvc.perform(post("/api/invoices")
				.contentType(MediaType.APPLICATION_JSON)
				.content(discounted))
			.andExpect(status().isCreated())
			.andExpect(jsonPath("$.subtotal.amountMinorUnits").value(1500))
			.andExpect(jsonPath("$.discount.amountMinorUnits").value(300))
			.andExpect(jsonPath("$.total.amountMinorUnits").value(1200));

		String excessive = INVOICE_BODY.replace("\"currency\": \"EUR\",", "\"currency\": \"EUR\", \"discountMinor\": 2000,");
		mvc.perform(post("/api/invoices")
				.contentType(MediaType.APPLICATION_JSON)
				.content(excessive))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.details.field").value("discount"));

		mvc.perform(get("/api/invoices/statistics").param("userRef", "reader-42"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.userRef").value("reader-42"))
			.andExpect(jsonPath("$.totalInvoices").value(1))
			.andExpect(jsonPath("$.byStatus.ISSUED.count").value(1))
			.andExpect(jsonPath("$.byStatus.PAID.count").value(0))
			.andExpect(jsonPath("$.outstanding.EUR").value(1200));
	}

	// ============ Subscriptions ============

	@Test
	void postSubscription_thenPauseAndCancel() throws Exception {
		String body = """
			{
			  "userRef": "reader-42",
			  "planCode": "premium",
			  "priceMinor": 999,
			  "currency": "EUR",
			  "frequency": "MONTHLY",
			  "provider": "card",
			  "paymentMethodRef": "pm_card_visa"
			}
			""";
		MvcResult created = mvc.perform(post("/api/subscriptions")
				.contentType(MediaType.APPLICATION_JSON)
				.content(body))
			.andExpect(status().isCreated())
			.andExpect(jsonPath("$.status").value("ACTIVE"))
			.andExpect(jsonPath("$.price.amountMinorUnits").value(999))
			.andReturn();
		String id = json(created).get("subscriptionId").asText();

		mvc.perform(post("/api/subscriptions/" + id + "/pause"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("PAUSED"));

		mvc.perform(get("/api/subscriptions/" + id))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.chargeAttempts", hasSize(0)));

		mvc.perform(post("/api/subscriptions/" + id + "/cancel"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("CANCELLED"));

		mvc.perform(post("/api/subscriptions/" + id + "/resume"))
			.andExpect(status().isConflict());
	}

	@Test
	void postSubscription_unknownFrequency_should400() throws Exception {
		String body = """
			{"userRef": "reader-42", "planCode": "premium", "priceMinor": 999, "currency": "EUR",
			 "frequency": "WEEKLY", "provider": "card", "paymentMethodRef": "pm_card_visa"}
			""";
		mvc.perform(post("/api/subscriptions")
				.contentType(MediaType.APPLICATION_JSON)
				.content(body))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.details.field").value("frequency"));
	}

	// ============ Configuration ============

	@Test
	void config_addVersionResolveAndHistory() throws Exception {
		mvc.perform(post("/api/config")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"type\":\"ROYALTY_RATE\",\"key\":\"DIRECT_SALE\",\"value\":\"0.65\","
					+ "\"effectiveFrom\":\"2025-06-01T00:00:00Z\",\"actor\":\"finance\"}"))
			.andExpect(status().isCreated())
			.andExpect(jsonPath("$.type").value("ROYALTY_RATE"))
			.andExpect(jsonPath("$.createdBy").value("finance"));

		mvc.perform(get("/api/config/ROYALTY_RATE/DIRECT_SALE").param("asOf", "2025-07-01T00:00:00Z"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.value", startsWith("0.65")));

		mvc.perform(get("/api/config/ROYALTY_RATE/DIRECT_SALE").param("asOf", "2025-03-01T00:00:00Z"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.value", startsWith("0.7")));

		mvc.perform(get("/api/config/ROYALTY_RATE/DIRECT_SALE/history"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$", hasSize(1)));
	}

	@Test
	void config_missingKey_should404() throws Exception {
		mvc.perform(get("/api/config/PAYOUT_THRESHOLD/XAF"))
			.andExpect(status().isNotFound());
	}

	@Test
	void config_invalidValues_should400() throws Exception {
		mvc.perform(post("/api/config")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"type\":\"ROYALTY_RATE\",\"key\":\"TIP\",\"value\":\"1.5\"}"))
			.andExpect(status().isBadRequest());

		mvc.perform(post("/api/config")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"type\":\"NOT_A_TYPE\",\"key\":\"x\",\"value\":1}"))
			.andExpect(status().isBadRequest());
	}

	// ============ Royalties ============

	@Test
	void royalties_computeThenSummary() throws Exception {
		Instant at = Instant.parse("2025-01-10T12:00:00Z");
		ledger.ingest(PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, "ch_roy_1")
			.amount(Money.ofMinor(10000, CurrencyCode.EUR))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.authorRef("author-7")
			.revenueStream(RevenueStream.DIRECT_SALE)
			.createdAt(at)
			.settledAt(at)
			.build());

		MvcResult computed = mvc.perform(post("/api/royalties/compute")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"periodStart\":\"2025-01-01\",\"periodEnd\":\"2025-02-01\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.mode").value("COMPUTE"))
			.andExpect(jsonPath("$.records", hasSize(1)))
			.andExpect(jsonPath("$.records[0].payable.amountMinorUnits").value(7000))
			.andExpect(jsonPath("$.records[0].status").value("PAYABLE"))
			.andReturn();
		String royaltyId = json(computed).get("records").get(0).get("royaltyId").asText();

		mvc.perform(get("/api/royalties/author-7").param("start", "2025-01-01").param("end", "2025-02-01"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.records", hasSize(1)))
			.andExpect(jsonPath("$.totalPayable.EUR").value(7000));

		MvcResult paid = mvc.perform(post("/api/royalties/" + royaltyId + "/paid")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"provider\":\"card\",\"providerTransactionId\":\"po_api_1\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("PAID"))
			.andReturn();
		assertThat(json(paid).get("payoutTransactionId").isNull()).isFalse();
	}

	@Test
	void royalties_invoiceThenPayout_settlesInvoice() throws Exception {
		Instant at = Instant.parse("2025-01-10T12:00:00Z");
		ledger.ingest(PaymentTransaction.builder()
			.externalRef(PaymentProvider.CARD, "ch_roy_inv")
			.amount(Money.ofMinor(10000, CurrencyCode.EUR))
			.kind(TransactionKind.CHARGE)
			.status(TransactionStatus.SETTLED)
			.authorRef("author-7")
			.revenueStream(RevenueStream.DIRECT_SALE)
			.createdAt(at)
			.settledAt(at)
			.build());
		MvcResult computed = mvc.perform(post("/api/royalties/compute")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"periodStart\":\"2025-01-01\",\"periodEnd\":\"2025-02-01\"}"))
			.andExpect(status().isOk())
			.andReturn();
		String royaltyId = json(computed).get("records").get(0).get("royaltyId").asText();

		MvcResult invoiced = mvc.perform(post("/api/royalties/author-7/invoices")
				.param("start", "2025-01-01").param("end", "2025-02-01"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$", hasSize(1)))
			.andExpect(jsonPath("$[0].userRef").value("author-7"))
			.andExpect(jsonPath("$[0].status").value("ISSUED"))
			.andExpect(jsonPath("$[0].total.amountMinorUnits").value(7000))
			.andReturn();
		String invoiceId = json(invoiced).get(0).get("invoiceId").asText();

		mvc.perform(get("/api/royalties/records/" + royaltyId))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("INVOICED"))
			.andExpect(jsonPath("$.invoiceId").value(invoiceId));

		mvc.perform(post("/api/royalties/compute")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"periodStart\":\"2025-01-01\",\"periodEnd\":\"2025-02-01\"}"))
			.andExpect(status().isConflict());

		mvc.perform(post("/api/royalties/" + royaltyId + "/paid")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"provider\":\"card\",\"providerTransactionId\":\"po_api_inv\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("PAID"));

		mvc.perform(get("/api/invoices/" + invoiceId))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("PAID"));
	}

	@Test
	void royalties_badDateOrMode_should400() throws Exception {
		mvc.perform(get("/api/royalties/author-7").param("start", "01/01/2025").param("end", "2025-02-01"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.details.field").value("start"));

		mvc.perform(post("/api/royalties/compute")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"periodStart\":\"2025-01-01\",\"periodEnd\":\"2025-02-01\",\"mode\":\"DRY_RUN\"}"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.details.field").value("mode"));
	}

	// ============ Rate limiting ============

	@Test
	void apiRequest_rateLimited_should429() throws Exception {
		Mockito.when(rateLimiter.tryConsumeApi()).thenReturn(false);

		mvc.perform(get("/api/invoices").param("userRef", "reader-42"))
			.andExpect(status().isTooManyRequests());
	}
}
