package io.coko.billing.api;

import io.coko.billing.gateway.CardProcessorGateway;
import io.coko.billing.gateway.OrangeMoneyGateway;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.InvoiceStatus;
import io.coko.billing.invoice.ItemType;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.ratelimit.BillingRateLimiter;
import io.coko.billing.royalty.AuthorRoyalty;
import io.coko.billing.royalty.RoyaltyCalculator;
import io.coko.billing.royalty.RoyaltyPeriod;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Provider webhooks end to end: signature check, normalization, ledger insert and invoice payment.
 */
@AutoConfigureMockMvc(addFilters = false)
class WebhookControllerTest extends AbstractIntegrationTest {

	@Autowired
	private MockMvc mvc;

	@Autowired
	private CardProcessorGateway cardGateway;

	@Autowired
	private InvoiceManager invoiceManager;

	@Autowired
	private RoyaltyCalculator royaltyCalculator;

	@MockBean
	private BillingRateLimiter rateLimiter;

	@BeforeEach
	void allowTraffic() {
		Mockito.when(rateLimiter.tryConsumeWebhook(Mockito.any())).thenReturn(true);
		Mockito.when(rateLimiter.tryConsumeApi()).thenReturn(true);
	}

	private Invoice issueInvoice(long minor) {
		return invoiceManager.createInvoice("reader-1",
			List.of(new InvoiceItem("Ebook", 1, Money.ofMinor(minor, CurrencyCode.EUR), ItemType.BOOK_PURCHASE, "author-9")),
			CurrencyCode.EUR);
	}

	private String chargeSucceeded(String chargeId, long amount, Invoice invoice) {
		return "{\"type\":\"charge.succeeded\",\"data\":{\"object\":{\"id\":\"" + chargeId + "\",\"amount\":" + amount
			+ ",\"currency\":\"eur\",\"metadata\":{\"reference\":\"invoice:" + invoice.getInvoiceId() + "\"}}}}";
	}

	private String signature(String body) {
		String ts = String.valueOf(clock.instant().getEpochSecond());
		return "t=" + ts + ",v1=" + cardGateway.sign(ts, body.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void cardWebhook_validCharge_paysInvoice() throws Exception {
		Invoice invoice = issueInvoice(1299);
		String body = chargeSucceeded("ch_web_1", 1299, invoice);

		mvc.perform(post("/api/webhooks/card")
				.contentType(MediaType.APPLICATION_JSON)
				.header(CardProcessorGateway.SIGNATURE_HEADER, signature(body))
				.content(body))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value("inserted"))
			.andExpect(jsonPath("$.transactionId").exists());

		Invoice paid = invoiceManager.getInvoice(invoice.getInvoiceId());
		assertThat(paid.getStatus()).isEqualTo(InvoiceStatus.PAID);
		Integer authored = jdbc.queryForObject(
			"SELECT COUNT(1) FROM payment_transaction WHERE provider_transaction_id = 'ch_web_1' AND author_ref = 'author-9'",
			Integer.class);
		assertThat(authored).isEqualTo(1);
	}

	@Test
	void cardWebhook_replayedEvent_isDuplicate() throws Exception {
		Invoice invoice = issueInvoice(500);
		String body = chargeSucceeded("ch_web_2", 500, invoice);

		mvc.perform(post("/api/webhooks/card").header(CardProcessorGateway.SIGNATURE_HEADER, signature(body)).content(body))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value("inserted"));
		mvc.perform(post("/api/webhooks/card").header(CardProcessorGateway.SIGNATURE_HEADER, signature(body)).content(body))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value("duplicate"));

		Integer rows = jdbc.queryForObject("SELECT COUNT(1) FROM payment_transaction", Integer.class);
		assertThat(rows).isEqualTo(1);
		Integer paidAudits = jdbc.queryForObject(
			"SELECT COUNT(1) FROM billing_audit_log WHERE entity_type = 'INVOICE' AND action = 'PAID'", Integer.class);
		assertThat(paidAudits).isEqualTo(1);
		List<AuthorRoyalty> royalties = royaltyCalculator.computeAuthorRoyalties("author-9",
			RoyaltyPeriod.ofMonth(YearMonth.of(2025, 1)));
		assertThat(royalties).hasSize(1);
		assertThat(royalties.get(0).getSourceTransactionIds()).hasSize(1);
		assertThat(royalties.get(0).getGrossBase()).isEqualTo(Money.ofMinor(500, CurrencyCode.EUR));
	}

	@Test
	void cardWebhook_standalonePurchase_isInvoicedAsPaid() throws Exception {
		String body = "{\"type\":\"charge.succeeded\",\"data\":{\"object\":{\"id\":\"ch_web_solo\",\"amount\":799,"
			+ "\"currency\":\"eur\",\"metadata\":{\"user_ref\":\"reader-7\",\"author_ref\":\"author-9\"}}}}";

		mvc.perform(post("/api/webhooks/card").header(CardProcessorGateway.SIGNATURE_HEADER, signature(body)).content(body))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value("inserted"));
		mvc.perform(post("/api/webhooks/card").header(CardProcessorGateway.SIGNATURE_HEADER, signature(body)).content(body))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value("duplicate"));

		List<Invoice> invoices = invoiceManager.listInvoices("reader-7");
		assertThat(invoices).hasSize(1);
		assertThat(invoices.get(0).getStatus()).isEqualTo(InvoiceStatus.PAID);
		assertThat(invoices.get(0).getStoredTotal()).isEqualTo(Money.ofMinor(799, CurrencyCode.EUR));
		assertThat(invoices.get(0).getSourceTransactionId()).isNotNull();
	}

	@Test
	void cardWebhook_badSignature_is401AndWritesNothing() throws Exception {
		Invoice invoice = issueInvoice(500);
		String body = chargeSucceeded("ch_web_3", 500, invoice);

		mvc.perform(post("/api/webhooks/card")
				.header(CardProcessorGateway.SIGNATURE_HEADER, "t=" + clock.instant().getEpochSecond() + ",v1=00ff")
				.content(body))
			.andExpect(status().isUnauthorized())
			.andExpect(jsonPath("$.error").value("unauthenticated"));

		Integer rows = jdbc.queryForObject("SELECT COUNT(1) FROM payment_transaction", Integer.class);
		assertThat(rows).isZero();
	}

	@Test
	void cardWebhook_malformedPayload_is400() throws Exception {
		String body = "{\"type\":\"charge.succeeded\",\"data\":{}}";

		mvc.perform(post("/api/webhooks/card").header(CardProcessorGateway.SIGNATURE_HEADER, signature(body)).content(body))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.error").value("validation_failed"));
	}

	@Test
	void orangeWebhook_tokenAuthenticated_isIgnoredWhenPending() throws Exception {
		mvc.perform(post("/api/webhooks/orange_money")
				.header(OrangeMoneyGateway.SIGNATURE_HEADER, "test-orange-notif-token")
				.content("{\"status\":\"PENDING\",\"txnid\":\"om-1\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.result").value("ignored"));
	}

	@Test
	void unknownProvider_is404() throws Exception {
		mvc.perform(post("/api/webhooks/paypal").content("{}"))
			.andExpect(status().isNotFound());
	}

	@Test
	void rateLimited_is429() throws Exception {
		Mockito.when(rateLimiter.tryConsumeWebhook(PaymentProvider.CARD)).thenReturn(false);

		mvc.perform(post("/api/webhooks/card").content("{}"))
			.andExpect(status().isTooManyRequests())
			.andExpect(jsonPath("$.error").value("rate_limited"));
	}
}
