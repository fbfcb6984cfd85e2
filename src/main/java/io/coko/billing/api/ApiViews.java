package io.coko.billing.api;

import io.coko.billing.configstore.ConfigEntry;
import io.coko.billing.configstore.ConfigValue;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceStatistics;
import io.coko.billing.invoice.InvoiceStatus;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.royalty.AuthorRoyalty;
import io.coko.billing.royalty.RoyaltySummary;
import io.coko.billing.subscription.ChargeAttempt;
import io.coko.billing.subscription.Subscription;
import io.coko.billing.subscription.SubscriptionStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON views of engine objects. Amounts are always exposed in minor units next to their currency.
 */
final class ApiViews {

	private ApiViews() {
	}

	static Map<String, Object> money(Money money) {
		if (money == null) {
			return null;
		}
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("amountMinorUnits", money.getAmountMinorUnits());
		m.put("currency", money.getCurrency().getCode());
		return m;
	}

	static Map<String, Object> moneyByCurrency(Map<CurrencyCode, Money> totals) {
		Map<String, Object> m = new LinkedHashMap<>();
		totals.forEach((currency, amount) -> m.put(currency.getCode(), amount.getAmountMinorUnits()));
		return m;
	}

	static Map<String, Object> invoice(Invoice invoice) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("invoiceId", invoice.getInvoiceId());
		m.put("invoiceNumber", invoice.getInvoiceNumber());
		m.put("billingEntity", invoice.getBillingEntity());
		m.put("userRef", invoice.getUserRef());
		m.put("status", invoice.getStatus().name());
		m.put("subtotal", money(invoice.getSubtotal()));
		m.put("discount", money(invoice.getDiscount()));
		m.put("total", money(invoice.getTotal()));
		m.put("subscriptionId", invoice.getSubscriptionId());
		m.put("sourceTransactionId", invoice.getSourceTransactionId());
		m.put("periodStart", invoice.getPeriodStart());
		m.put("periodEnd", invoice.getPeriodEnd());
		m.put("issuedAt", invoice.getIssuedAt());
		m.put("dueAt", invoice.getDueAt());
		m.put("paidAt", invoice.getPaidAt());
		m.put("voidedAt", invoice.getVoidedAt());
		m.put("voidReason", invoice.getVoidReason());
		List<Map<String, Object>> items = new ArrayList<>();
		for (InvoiceItem item : invoice.getItems()) {
			Map<String, Object> line = new LinkedHashMap<>();
			line.put("description", item.getDescription());
			line.put("quantity", item.getQuantity());
			line.put("unitPrice", money(item.getUnitPrice()));
			line.put("itemType", item.getItemType().getCode());
			line.put("authorRef", item.getAuthorRef());
			line.put("lineTotal", money(item.getLineTotal()));
			items.add(line);
		}
		m.put("items", items);
		return m;
	}

	static Map<String, Object> invoiceStatistics(InvoiceStatistics statistics) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("userRef", statistics.getUserRef());
		m.put("totalInvoices", statistics.getTotalInvoices());
		Map<String, Object> byStatus = new LinkedHashMap<>();
		for (InvoiceStatus status : InvoiceStatus.values()) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("count", statistics.getCount(status));
			entry.put("totals", moneyByCurrency(statistics.getTotals(status)));
			byStatus.put(status.name(), entry);
		}
		m.put("byStatus", byStatus);
		m.put("outstanding", moneyByCurrency(statistics.getOutstanding()));
		return m;
	}

	static Map<String, Object> subscription(Subscription s) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("subscriptionId", s.getSubscriptionId());
		m.put("userRef", s.getUserRef());
		m.put("planCode", s.getPlanCode());
		m.put("price", money(s.getPrice()));
		m.put("frequency", s.getFrequency().getCode());
		m.put("provider", s.getProvider().getCode());
		m.put("status", s.getStatus().getCode());
		// coarse code shown to the reader; dunning detail stays internal
		m.put("billingIssue", s.getStatus() == SubscriptionStatus.PAST_DUE ? "subscription_past_due" : null);
		m.put("startAt", s.getStartAt());
		m.put("currentPeriodEnd", s.getCurrentPeriodEnd());
		m.put("nextRetryAt", s.getNextRetryAt());
		m.put("failedAttemptCount", s.getFailedAttemptCount());
		m.put("totalCycles", s.getTotalCycles());
		m.put("completedCycles", s.getCompletedCycles());
		return m;
	}

	static Map<String, Object> chargeAttempt(ChargeAttempt a) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("attemptId", a.getAttemptId());
		m.put("invoiceId", a.getInvoiceId());
		m.put("attemptNumber", a.getAttemptNumber());
		m.put("provider", a.getProvider().getCode());
		m.put("providerTransactionId", a.getProviderTransactionId());
		m.put("status", a.getStatus().name());
		m.put("failureCode", a.getFailureCode());
		m.put("createdAt", a.getCreatedAt());
		return m;
	}

	static Map<String, Object> royalty(AuthorRoyalty r) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("royaltyId", r.getRoyaltyId());
		m.put("authorRef", r.getAuthorRef());
		m.put("periodStart", r.getPeriodStart());
		m.put("periodEnd", r.getPeriodEnd());
		m.put("revenueStream", r.getRevenueStream().getCode());
		m.put("grossBase", money(r.getGrossBase()));
		m.put("rateApplied", r.getRateApplied() != null ? r.getRateApplied().toPlainString() : null);
		m.put("payable", money(r.getPayable()));
		m.put("carried", money(r.getCarried()));
		m.put("totalDue", money(r.getTotalDue()));
		m.put("status", r.getStatus().name());
		m.put("correctionOf", r.getCorrectionOf());
		m.put("carriedInto", r.getCarriedInto());
		m.put("invoiceId", r.getInvoiceId());
		m.put("payoutTransactionId", r.getPayoutTransactionId());
		m.put("paidAt", r.getPaidAt());
		m.put("computedAt", r.getComputedAt());
		m.put("sourceTransactionIds", r.getSourceTransactionIds());
		return m;
	}

	static Map<String, Object> royaltySummary(RoyaltySummary summary) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("authorRef", summary.getAuthorRef());
		m.put("periodStart", summary.getPeriod().getStart());
		m.put("periodEnd", summary.getPeriod().getEnd());
		m.put("totalPayable", moneyByCurrency(summary.getTotalPayable()));
		m.put("totalPaid", moneyByCurrency(summary.getTotalPaid()));
		m.put("totalOutstanding", moneyByCurrency(summary.getTotalOutstanding()));
		List<Map<String, Object>> records = new ArrayList<>();
		summary.getRecords().forEach(r -> records.add(royalty(r)));
		m.put("records", records);
		return m;
	}

	static Map<String, Object> configEntry(ConfigEntry entry) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("id", entry.getId());
		m.put("type", entry.getConfigType().getCode());
		m.put("key", entry.getKey());
		m.put("value", configValue(entry.getValue()));
		m.put("effectiveFrom", entry.getEffectiveFrom());
		m.put("createdAt", entry.getCreatedAt());
		m.put("createdBy", entry.getCreatedBy());
		return m;
	}

	static Object configValue(ConfigValue value) {
		if (value instanceof ConfigValue.DecimalValue) {
			return ((ConfigValue.DecimalValue) value).getValue().toPlainString();
		} else if (value instanceof ConfigValue.MoneyValue) {
			return money(((ConfigValue.MoneyValue) value).getValue());
		} else if (value instanceof ConfigValue.IntegerValue) {
			return ((ConfigValue.IntegerValue) value).getValue();
		} else if (value instanceof ConfigValue.DayListValue) {
			return ((ConfigValue.DayListValue) value).getDays();
		} else if (value instanceof ConfigValue.CurrencyListValue) {
			List<String> codes = new ArrayList<>();
			((ConfigValue.CurrencyListValue) value).getCurrencies().forEach(c -> codes.add(c.getCode()));
			return codes;
		}
		return String.valueOf(value);
	}
}
