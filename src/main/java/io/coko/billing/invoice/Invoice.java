package io.coko.billing.invoice;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class Invoice {

	private UUID invoiceId;
	private String billingEntity;
	private long sequenceNumber;
	private String invoiceNumber;
	private String userRef;
	private CurrencyCode currency;
	private Money discount;
	private Money storedTotal;
	private InvoiceStatus status;
	private List<InvoiceItem> items = new ArrayList<>();
	private UUID subscriptionId;
	private UUID sourceTransactionId;
	private Instant periodStart;
	private Instant periodEnd;
	private Instant issuedAt;
	private Instant dueAt;
	private Instant paidAt;
	private Instant voidedAt;
	private String voidReason;
	private Instant createdAt;

	/**
	 * Sum of quantity times unit price over all items.
	 */
	public Money getSubtotal() {
		Money subtotal = Money.zero(currency);
		for (InvoiceItem item : items) {
			subtotal = subtotal.add(item.getLineTotal());
		}
		return subtotal;
	}

	/**
	 * Subtotal less the discount.
	 */
	public Money getTotal() {
		return getSubtotal().subtract(getDiscount());
	}

	public Money getDiscount() {
		return discount != null ? discount : Money.zero(currency);
	}

	public void setDiscount(Money discount) {
		this.discount = discount;
	}

	public UUID getInvoiceId() {
		return invoiceId;
	}

	public void setInvoiceId(UUID invoiceId) {
		this.invoiceId = invoiceId;
	}

	public String getBillingEntity() {
		return billingEntity;
	}

	public void setBillingEntity(String billingEntity) {
		this.billingEntity = billingEntity;
	}

	public long getSequenceNumber() {
		return sequenceNumber;
	}

	public void setSequenceNumber(long sequenceNumber) {
		this.sequenceNumber = sequenceNumber;
	}

	public String getInvoiceNumber() {
		return invoiceNumber;
	}

	public void setInvoiceNumber(String invoiceNumber) {
		this.invoiceNumber = invoiceNumber;
	}

	public String getUserRef() {
		return userRef;
	}

	public void setUserRef(String userRef) {
		this.userRef = userRef;
	}

	public CurrencyCode getCurrency() {
		return currency;
	}

	public void setCurrency(CurrencyCode currency) {
		this.currency = currency;
	}

	/**
	 * Total persisted when the invoice was created. Always equal to {@link #getTotal()}.
	 */
	public Money getStoredTotal() {
		return storedTotal;
	}

	public void setStoredTotal(Money storedTotal) {
		this.storedTotal = storedTotal;
	}

	public InvoiceStatus getStatus() {
		return status;
	}

	public void setStatus(InvoiceStatus status) {
		this.status = status;
	}

	public List<InvoiceItem> getItems() {
		return items;
	}

	public void setItems(List<InvoiceItem> items) {
		this.items = items;
	}

	public UUID getSubscriptionId() {
		return subscriptionId;
	}

	public void setSubscriptionId(UUID subscriptionId) {
		this.subscriptionId = subscriptionId;
	}

	/**
	 * Ledger transaction this invoice was raised for after the fact, if any.
	 */
	public UUID getSourceTransactionId() {
		return sourceTransactionId;
	}

	public void setSourceTransactionId(UUID sourceTransactionId) {
		this.sourceTransactionId = sourceTransactionId;
	}

	public Instant getPeriodStart() {
		return periodStart;
	}

	public void setPeriodStart(Instant periodStart) {
		this.periodStart = periodStart;
	}

	public Instant getPeriodEnd() {
		return periodEnd;
	}

	public void setPeriodEnd(Instant periodEnd) {
		this.periodEnd = periodEnd;
	}

	public Instant getIssuedAt() {
		return issuedAt;
	}

	public void setIssuedAt(Instant issuedAt) {
		this.issuedAt = issuedAt;
	}

	public Instant getDueAt() {
		return dueAt;
	}

	public void setDueAt(Instant dueAt) {
		this.dueAt = dueAt;
	}

	public Instant getPaidAt() {
		return paidAt;
	}

	public void setPaidAt(Instant paidAt) {
		this.paidAt = paidAt;
	}

	public Instant getVoidedAt() {
		return voidedAt;
	}

	public void setVoidedAt(Instant voidedAt) {
		this.voidedAt = voidedAt;
	}

	public String getVoidReason() {
		return voidReason;
	}

	public void setVoidReason(String voidReason) {
		this.voidReason = voidReason;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(Instant createdAt) {
		this.createdAt = createdAt;
	}

	@Override
	public String toString() {
		return "Invoice{id=" + invoiceId + ", number=" + invoiceNumber + ", status=" + status
			+ ", total=" + storedTotal + "}";
	}
}
