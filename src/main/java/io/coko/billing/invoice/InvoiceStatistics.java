package io.coko.billing.invoice;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Invoice counts and totals per status, totals kept apart per currency.
 */
public class InvoiceStatistics {

	private final String userRef;
	private final Map<InvoiceStatus, Long> counts = new EnumMap<>(InvoiceStatus.class);
	private final Map<InvoiceStatus, Map<CurrencyCode, Money>> totals = new EnumMap<>(InvoiceStatus.class);

	public InvoiceStatistics(String userRef) {
		this.userRef = userRef;
	}

	void add(InvoiceStatus status, CurrencyCode currency, long count, Money total) {
		counts.merge(status, count, Long::sum);
		totals.computeIfAbsent(status, s -> new EnumMap<>(CurrencyCode.class)).merge(currency, total, Money::add);
	}

	/**
	 * Null when the statistics cover every user.
	 */
	public String getUserRef() {
		return userRef;
	}

	public long getTotalInvoices() {
		return counts.values().stream().mapToLong(Long::longValue).sum();
	}

	public long getCount(InvoiceStatus status) {
		return counts.getOrDefault(status, 0L);
	}

	public Map<CurrencyCode, Money> getTotals(InvoiceStatus status) {
		return Collections.unmodifiableMap(totals.getOrDefault(status, Collections.emptyMap()));
	}

	/**
	 * Issued or overdue amounts still waiting for payment.
	 */
	public Map<CurrencyCode, Money> getOutstanding() {
		Map<CurrencyCode, Money> outstanding = new EnumMap<>(CurrencyCode.class);
		getTotals(InvoiceStatus.ISSUED).forEach((currency, amount) -> outstanding.merge(currency, amount, Money::add));
		getTotals(InvoiceStatus.OVERDUE).forEach((currency, amount) -> outstanding.merge(currency, amount, Money::add));
		return outstanding;
	}
}
