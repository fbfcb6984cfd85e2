package io.coko.billing.royalty;

import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Royalty owed to one author for one period, revenue stream and currency.
 */
public class AuthorRoyalty {

	private UUID royaltyId;
	private String authorRef;
	private LocalDate periodStart;
	private LocalDate periodEnd;
	private RevenueStream revenueStream;
	private CurrencyCode currency;
	private Money grossBase;
	private BigDecimal rateApplied;
	private Money payable;
	private Money carried;
	private RoyaltyStatus status;
	private UUID correctionOf;
	private UUID carriedInto;
	private UUID invoiceId;
	private UUID payoutTransactionId;
	private Instant paidAt;
	private Instant computedAt;
	private List<UUID> sourceTransactionIds = new ArrayList<>();

	/**
	 * Amount due on payout: this period's royalty plus what was carried in.
	 */
	public Money getTotalDue() {
		return payable.add(carried);
	}

	public boolean isCorrection() {
		return correctionOf != null;
	}

	public RoyaltyPeriod getPeriod() {
		return RoyaltyPeriod.of(periodStart, periodEnd);
	}

	public UUID getRoyaltyId() {
		return royaltyId;
	}

	public void setRoyaltyId(UUID royaltyId) {
		this.royaltyId = royaltyId;
	}

	public String getAuthorRef() {
		return authorRef;
	}

	public void setAuthorRef(String authorRef) {
		this.authorRef = authorRef;
	}

	public LocalDate getPeriodStart() {
		return periodStart;
	}

	public void setPeriodStart(LocalDate periodStart) {
		this.periodStart = periodStart;
	}

	public LocalDate getPeriodEnd() {
		return periodEnd;
	}

	public void setPeriodEnd(LocalDate periodEnd) {
		this.periodEnd = periodEnd;
	}

	public RevenueStream getRevenueStream() {
		return revenueStream;
	}

	public void setRevenueStream(RevenueStream revenueStream) {
		this.revenueStream = revenueStream;
	}

	public CurrencyCode getCurrency() {
		return currency;
	}

	public void setCurrency(CurrencyCode currency) {
		this.currency = currency;
	}

	public Money getGrossBase() {
		return grossBase;
	}

	public void setGrossBase(Money grossBase) {
		this.grossBase = grossBase;
	}

	public BigDecimal getRateApplied() {
		return rateApplied;
	}

	public void setRateApplied(BigDecimal rateApplied) {
		this.rateApplied = rateApplied;
	}

	public Money getPayable() {
		return payable;
	}

	public void setPayable(Money payable) {
		this.payable = payable;
	}

	public Money getCarried() {
		return carried;
	}

	public void setCarried(Money carried) {
		this.carried = carried;
	}

	public RoyaltyStatus getStatus() {
		return status;
	}

	public void setStatus(RoyaltyStatus status) {
		this.status = status;
	}

	public UUID getCorrectionOf() {
		return correctionOf;
	}

	public void setCorrectionOf(UUID correctionOf) {
		this.correctionOf = correctionOf;
	}

	public UUID getCarriedInto() {
		return carriedInto;
	}

	public void setCarriedInto(UUID carriedInto) {
		this.carriedInto = carriedInto;
	}

	public UUID getInvoiceId() {
		return invoiceId;
	}

	public void setInvoiceId(UUID invoiceId) {
		this.invoiceId = invoiceId;
	}

	public UUID getPayoutTransactionId() {
		return payoutTransactionId;
	}

	public void setPayoutTransactionId(UUID payoutTransactionId) {
		this.payoutTransactionId = payoutTransactionId;
	}

	public Instant getPaidAt() {
		return paidAt;
	}

	public void setPaidAt(Instant paidAt) {
		this.paidAt = paidAt;
	}

	public Instant getComputedAt() {
		return computedAt;
	}

	public void setComputedAt(Instant computedAt) {
		this.computedAt = computedAt;
	}

	public List<UUID> getSourceTransactionIds() {
		return sourceTransactionIds;
	}

	public void setSourceTransactionIds(List<UUID> sourceTransactionIds) {
		this.sourceTransactionIds = sourceTransactionIds;
	}

	@Override
	public String toString() {
		return "AuthorRoyalty{author=" + authorRef + ", period=[" + periodStart + ", " + periodEnd + "), stream="
			+ revenueStream + ", gross=" + grossBase + ", payable=" + payable + ", carried=" + carried
			+ ", status=" + status + "}";
	}
}
