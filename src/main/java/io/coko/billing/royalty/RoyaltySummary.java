package io.coko.billing.royalty;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * An author's royalty records for one period, with per-currency totals.
 */
public class RoyaltySummary {

	private final String authorRef;
	private final RoyaltyPeriod period;
	private final List<AuthorRoyalty> records;

	public RoyaltySummary(String authorRef, RoyaltyPeriod period, List<AuthorRoyalty> records) {
		this.authorRef = authorRef;
		this.period = period;
		this.records = List.copyOf(records);
	}

	public String getAuthorRef() {
		return authorRef;
	}

	public RoyaltyPeriod getPeriod() {
		return period;
	}

	public List<AuthorRoyalty> getRecords() {
		return records;
	}

	public Map<CurrencyCode, Money> getTotalPayable() {
		return totals(null);
	}

	public Map<CurrencyCode, Money> getTotalPaid() {
		return totals(RoyaltyStatus.PAID);
	}

	public Map<CurrencyCode, Money> getTotalOutstanding() {
		Map<CurrencyCode, Money> outstanding = new EnumMap<>(CurrencyCode.class);
		for (AuthorRoyalty record : records) {
			if (record.getStatus() != RoyaltyStatus.PAID && record.getCarriedInto() == null) {
				outstanding.merge(record.getCurrency(), record.getTotalDue(), Money::add);
			}
		}
		return outstanding;
	}

	private Map<CurrencyCode, Money> totals(RoyaltyStatus status) {
		Map<CurrencyCode, Money> totals = new EnumMap<>(CurrencyCode.class);
		for (AuthorRoyalty record : records) {
			if (status == null || record.getStatus() == status) {
				totals.merge(record.getCurrency(), record.getPayable(), Money::add);
			}
		}
		return totals;
	}
}
