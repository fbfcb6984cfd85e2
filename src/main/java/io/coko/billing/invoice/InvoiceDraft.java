package io.coko.billing.invoice;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Input for {@link InvoiceManager#createInvoice(InvoiceDraft)}.
 */
public class InvoiceDraft {

	private final String billingEntity;
	private final String userRef;
	private final CurrencyCode currency;
	private final List<InvoiceItem> items;
	private final Money discount;
	private final UUID subscriptionId;
	private final Instant periodStart;
	private final Instant periodEnd;
	private final UUID sourceTransactionId;
	private final Instant paidAt;

	private InvoiceDraft(String billingEntity, String userRef, CurrencyCode currency, List<InvoiceItem> items,
			Money discount, UUID subscriptionId, Instant periodStart, Instant periodEnd, UUID sourceTransactionId,
			Instant paidAt) {
		this.billingEntity = billingEntity;
		this.userRef = userRef;
		this.currency = currency;
		this.items = items;
		this.discount = discount;
		this.subscriptionId = subscriptionId;
		this.periodStart = periodStart;
		this.periodEnd = periodEnd;
		this.sourceTransactionId = sourceTransactionId;
		this.paidAt = paidAt;
	}

	public static InvoiceDraft oneOff(String billingEntity, String userRef, CurrencyCode currency, List<InvoiceItem> items) {
		return new InvoiceDraft(billingEntity, userRef, currency, items, null, null, null, null, null, null);
	}

	public static InvoiceDraft forSubscriptionPeriod(String billingEntity, String userRef, CurrencyCode currency,
			List<InvoiceItem> items, UUID subscriptionId, Instant periodStart, Instant periodEnd) {
		return new InvoiceDraft(billingEntity, userRef, currency, items, null, subscriptionId, periodStart, periodEnd,
			null, null);
	}

	/**
	 * Invoice for a payment that was already settled without one; it is issued as PAID.
	 */
	public static InvoiceDraft forSettledTransaction(String billingEntity, String userRef, CurrencyCode currency,
			List<InvoiceItem> items, UUID transactionId, Instant paidAt) {
		return new InvoiceDraft(billingEntity, userRef, currency, items, null, null, null, null, transactionId, paidAt);
	}

	public InvoiceDraft withDiscount(Money discount) {
		return new InvoiceDraft(billingEntity, userRef, currency, items, discount, subscriptionId, periodStart,
			periodEnd, sourceTransactionId, paidAt);
	}

	public String getBillingEntity() {
		return billingEntity;
	}

	public String getUserRef() {
		return userRef;
	}

	public CurrencyCode getCurrency() {
		return currency;
	}

	public List<InvoiceItem> getItems() {
		return items;
	}

	public Money getDiscount() {
		return discount;
	}

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public Instant getPeriodStart() {
		return periodStart;
	}

	public Instant getPeriodEnd() {
		return periodEnd;
	}

	public UUID getSourceTransactionId() {
		return sourceTransactionId;
	}

	public Instant getPaidAt() {
		return paidAt;
	}
}
