package io.coko.billing.royalty;

import io.coko.billing.audit.AuditService;
import io.coko.billing.config.BillingEngineProperties;
import io.coko.billing.configstore.BillingConfigurationService;
import io.coko.billing.configstore.ConfigType;
import io.coko.billing.exception.ImmutablePeriodException;
import io.coko.billing.exception.InvalidStateTransitionException;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.invoice.Invoice;
import io.coko.billing.invoice.InvoiceItem;
import io.coko.billing.invoice.InvoiceManager;
import io.coko.billing.invoice.ItemType;
import io.coko.billing.ledger.IngestOutcome;
import io.coko.billing.ledger.LedgerQuery;
import io.coko.billing.ledger.LedgerStore;
import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.ledger.PaymentTransaction;
import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.ledger.SubjectRef;
import io.coko.billing.ledger.TransactionKind;
import io.coko.billing.ledger.TransactionStatus;
import io.coko.billing.metrics.BillingMetrics;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Royalty computation per author, revenue stream and currency.
 *
 * Each settled charge counts positively and each refund or chargeback negatively, priced with
 * the royalty rate that was in effect when the transaction settled. Partial products are summed
 * exactly and rounded once per record. Amounts below the payout threshold stay ACCRUED and are
 * carried into the next computation of the same author, stream and currency.
 *
 * A record that is paid, invoiced or carried into a later record is closed: its period is no longer
 * recomputed in place and differences found later are appended as correction records.
 */
@Service
public class RoyaltyCalculator {

	private static final Logger log = LoggerFactory.getLogger(RoyaltyCalculator.class);

	private static final int EFFECTIVE_RATE_SCALE = 8;

	private final RoyaltyRepository repository;
	private final LedgerStore ledger;
	private final InvoiceManager invoiceManager;
	private final BillingConfigurationService configService;
	private final AuditService auditService;
	private final BillingMetrics metrics;
	private final TransactionTemplate txTemplate;
	private final BillingEngineProperties props;
	private final Clock clock;

	public RoyaltyCalculator(RoyaltyRepository repository, LedgerStore ledger, InvoiceManager invoiceManager,
			BillingConfigurationService configService, AuditService auditService, BillingMetrics metrics,
			TransactionTemplate txTemplate, BillingEngineProperties props, Clock clock) {
		this.repository = repository;
		this.ledger = ledger;
		this.invoiceManager = invoiceManager;
		this.configService = configService;
		this.auditService = auditService;
		this.metrics = metrics;
		this.txTemplate = txTemplate;
		this.props = props;
		this.clock = clock;
	}

	/**
	 * Compute (or recompute in place) every author's royalties for a period.
	 *
	 * @throws ImmutablePeriodException when any record of the period is closed; nothing is written
	 */
	public List<AuthorRoyalty> computeRoyalties(RoyaltyPeriod period) {
		if (repository.anyClosed(period)) {
			throw new ImmutablePeriodException(period,
				"Royalties for " + period + " are already paid, invoiced or carried forward; append corrections instead");
		}

		TreeSet<String> authors = new TreeSet<>(ledger.distinctAuthors(period.startInstant(), period.endInstant()));
		authors.addAll(repository.findAuthorsWithOpenCarry(period.getStart()));
		authors.addAll(repository.findAuthorsWithPeriodRecords(period));
		log.info("Royalty computation started: period={} authors={}", period, authors.size());

		List<AuthorRoyalty> computed = new ArrayList<>();
		for (String author : authors) {
			computed.addAll(computeAuthorRoyalties(author, period));
		}
		metrics.recordRoyaltiesComputed(computed.size());
		log.info("Royalty computation finished: period={} authors={} records={}", period, authors.size(), computed.size());
		return computed;
	}

	public List<AuthorRoyalty> computeAuthorRoyalties(String authorRef, RoyaltyPeriod period) {
		if (authorRef == null || authorRef.isBlank()) {
			throw new ValidationException("Author reference is required", "authorRef", authorRef);
		}
		repository.ensureLockRow(authorRef, period);
		List<AuthorRoyalty> records = txTemplate.execute(status -> {
			repository.lockAuthorPeriod(authorRef, period);
			if (repository.anyClosed(authorRef, period)) {
				throw new ImmutablePeriodException(period, "Royalties of " + authorRef + " for " + period
					+ " are already paid, invoiced or carried forward; append corrections instead");
			}
			return recompute(authorRef, period);
		});

		for (AuthorRoyalty record : records) {
			Map<String, Object> details = new HashMap<>();
			details.put("period", period.toString());
			details.put("payable", record.getPayable().toString());
			details.put("carried", record.getCarried().toString());
			details.put("status", record.getStatus().name());
			auditService.logRoyaltyEvent(record.getRoyaltyId(), "COMPUTED", details, "system");
		}
		return records;
	}

	/**
	 * Recompute a period whose royalties are (partly) closed. Closed records are never changed:
	 * each difference is appended as an ACCRUED correction record that the next computation carries in.
	 * Authors without a closed record are simply recomputed.
	 */
	public List<AuthorRoyalty> appendCorrections(RoyaltyPeriod period) {
		TreeSet<String> authors = new TreeSet<>(ledger.distinctAuthors(period.startInstant(), period.endInstant()));
		authors.addAll(repository.findAuthorsWithPeriodRecords(period));

		List<AuthorRoyalty> written = new ArrayList<>();
		for (String author : authors) {
			if (!repository.anyClosed(author, period)) {
				written.addAll(computeAuthorRoyalties(author, period));
				continue;
			}
			repository.ensureLockRow(author, period);
			List<AuthorRoyalty> corrections = txTemplate.execute(status -> {
				repository.lockAuthorPeriod(author, period);
				return correct(author, period);
			});
			for (AuthorRoyalty correction : corrections) {
				Map<String, Object> details = new HashMap<>();
				details.put("period", period.toString());
				details.put("correctionOf", String.valueOf(correction.getCorrectionOf()));
				details.put("delta", correction.getPayable().toString());
				auditService.logRoyaltyEvent(correction.getRoyaltyId(), "CORRECTION_APPENDED", details, "system");
			}
			written.addAll(corrections);
		}
		log.info("Royalty corrections finished: period={} records={}", period, written.size());
		return written;
	}

	/**
	 * Record the payout of a PAYABLE or INVOICED royalty: a PAYOUT ledger transaction for the total due,
	 * then PAID. The royalty invoice is settled once every record on it is paid.
	 * Repeating the call with the same payout reference returns the paid record unchanged.
	 */
	public AuthorRoyalty markPaid(UUID royaltyId, PaymentProvider provider, String providerTransactionId) {
		if (provider == null || providerTransactionId == null || providerTransactionId.isBlank()) {
			throw new ValidationException("Payout provider and transaction id are required");
		}
		Instant now = clock.instant();
		AuthorRoyalty paid = txTemplate.execute(status -> {
			AuthorRoyalty royalty = repository.findByIdForUpdate(royaltyId)
				.orElseThrow(() -> new NotFoundException("royalty", royaltyId));

			if (royalty.getStatus() == RoyaltyStatus.PAID) {
				Optional<PaymentTransaction> payout = royalty.getPayoutTransactionId() != null
					? ledger.findById(royalty.getPayoutTransactionId()) : Optional.empty();
				if (payout.isPresent() && payout.get().getProvider() == provider
					&& payout.get().getProviderTransactionId().equals(providerTransactionId)) {
					return royalty;
				}
				throw new InvalidStateTransitionException("royalty", RoyaltyStatus.PAID, RoyaltyStatus.PAID);
			}
			if (royalty.getStatus() != RoyaltyStatus.PAYABLE && royalty.getStatus() != RoyaltyStatus.INVOICED) {
				throw new InvalidStateTransitionException("royalty", royalty.getStatus(), RoyaltyStatus.PAID);
			}
			Money totalDue = royalty.getTotalDue();
			if (totalDue.isNegative() || totalDue.isZero()) {
				throw new ValidationException("Nothing to pay out for royalty " + royaltyId, "totalDue", totalDue);
			}

			PaymentTransaction payout = PaymentTransaction.builder()
				.id(UUID.randomUUID())
				.externalRef(provider, providerTransactionId)
				.amount(totalDue)
				.kind(TransactionKind.PAYOUT)
				.status(TransactionStatus.SETTLED)
				.subjectRef(royalty.getInvoiceId() != null ? SubjectRef.invoice(royalty.getInvoiceId()) : null)
				.authorRef(royalty.getAuthorRef())
				.revenueStream(royalty.getRevenueStream())
				.createdAt(now)
				.settledAt(now)
				.build();
			if (ledger.ingest(payout) == IngestOutcome.DUPLICATE) {
				throw new ValidationException("Payout reference " + provider + ":" + providerTransactionId
					+ " is already recorded", "providerTransactionId", providerTransactionId);
			}
			repository.markPaid(royaltyId, payout.getId(), now);
			royalty.setStatus(RoyaltyStatus.PAID);
			royalty.setPayoutTransactionId(payout.getId());
			royalty.setPaidAt(now);
			if (royalty.getInvoiceId() != null && repository.countUnpaidOnInvoice(royalty.getInvoiceId()) == 0) {
				invoiceManager.settleByPayout(royalty.getInvoiceId(), payout.getId());
			}
			return royalty;
		});

		if (now.equals(paid.getPaidAt())) {
			log.info("Royalty paid: id={} author={} amount={} payout={}",
				royaltyId, paid.getAuthorRef(), paid.getTotalDue(), paid.getPayoutTransactionId());
			Map<String, Object> details = new HashMap<>();
			details.put("amount", paid.getTotalDue().toString());
			details.put("provider", provider.getCode());
			details.put("providerTransactionId", providerTransactionId);
			auditService.logRoyaltyEvent(royaltyId, "PAID", details, "system");
		}
		return paid;
	}

	/**
	 * Issue royalty invoices for an author's PAYABLE records of a period, one invoice per currency
	 * with one line per record. The records move to INVOICED. Records already invoiced are skipped,
	 * so a second call issues nothing new.
	 */
	public List<Invoice> invoiceRoyalties(String authorRef, RoyaltyPeriod period) {
		if (authorRef == null || authorRef.isBlank()) {
			throw new ValidationException("Author reference is required", "authorRef", authorRef);
		}
		repository.ensureLockRow(authorRef, period);
		Map<Invoice, List<AuthorRoyalty>> issued = txTemplate.execute(status -> {
			repository.lockAuthorPeriod(authorRef, period);
			Map<CurrencyCode, List<AuthorRoyalty>> byCurrency = repository.findByAuthorPeriod(authorRef, period).stream()
				.filter(r -> r.getStatus() == RoyaltyStatus.PAYABLE && !r.getTotalDue().isNegative() && !r.getTotalDue().isZero())
				.collect(Collectors.groupingBy(AuthorRoyalty::getCurrency, () -> new EnumMap<>(CurrencyCode.class),
					Collectors.toList()));

			Map<Invoice, List<AuthorRoyalty>> invoices = new LinkedHashMap<>();
			for (Map.Entry<CurrencyCode, List<AuthorRoyalty>> entry : byCurrency.entrySet()) {
				List<InvoiceItem> items = new ArrayList<>();
				for (AuthorRoyalty record : entry.getValue()) {
					String description = "Royalties " + record.getRevenueStream().getCode() + " " + period
						+ (record.isCorrection() ? " (correction)" : "");
					items.add(new InvoiceItem(description, 1, record.getTotalDue(), ItemType.ROYALTY, authorRef));
				}
				Invoice invoice = invoiceManager.createInvoice(authorRef, items, entry.getKey());
				repository.markInvoiced(entry.getValue().stream().map(AuthorRoyalty::getRoyaltyId).collect(Collectors.toList()),
					invoice.getInvoiceId());
				invoices.put(invoice, entry.getValue());
			}
			return invoices;
		});

		for (Map.Entry<Invoice, List<AuthorRoyalty>> entry : issued.entrySet()) {
			Invoice invoice = entry.getKey();
			log.info("Royalty invoice issued: author={} period={} number={} total={} records={}",
				authorRef, period, invoice.getInvoiceNumber(), invoice.getStoredTotal(), entry.getValue().size());
			for (AuthorRoyalty record : entry.getValue()) {
				Map<String, Object> details = new HashMap<>();
				details.put("invoiceId", invoice.getInvoiceId().toString());
				details.put("invoiceNumber", invoice.getInvoiceNumber());
				details.put("amount", record.getTotalDue().toString());
				auditService.logRoyaltyEvent(record.getRoyaltyId(), "INVOICED", details, "system");
			}
		}
		return new ArrayList<>(issued.keySet());
	}

	public AuthorRoyalty getRoyalty(UUID royaltyId) {
		return repository.findById(royaltyId).orElseThrow(() -> new NotFoundException("royalty", royaltyId));
	}

	public RoyaltySummary getRoyaltySummary(String authorRef, RoyaltyPeriod period) {
		List<AuthorRoyalty> records = repository.findByAuthorPeriod(authorRef, period);
		for (AuthorRoyalty record : records) {
			record.setSourceTransactionIds(repository.findSources(record.getRoyaltyId()));
		}
		return new RoyaltySummary(authorRef, period, records);
	}

	// ============ Computation ============

	private List<AuthorRoyalty> recompute(String authorRef, RoyaltyPeriod period) {
		Instant now = clock.instant();
		Map<GroupKey, Accumulator> groups = accumulate(authorRef, period);

		Map<GroupKey, AuthorRoyalty> existing = new LinkedHashMap<>();
		for (AuthorRoyalty record : repository.findByAuthorPeriod(authorRef, period)) {
			if (!record.isCorrection()) {
				existing.put(new GroupKey(record.getRevenueStream(), record.getCurrency()), record);
			}
		}
		for (GroupKey key : existing.keySet()) {
			groups.computeIfAbsent(key, k -> new Accumulator(k.currency));
		}

		// Links from a previous run of this period are rebuilt below
		for (AuthorRoyalty record : existing.values()) {
			repository.releaseCarriedInto(record.getRoyaltyId());
		}
		Map<GroupKey, List<AuthorRoyalty>> carry = repository.findOpenCarry(authorRef, period.getStart()).stream()
			.collect(Collectors.groupingBy(r -> new GroupKey(r.getRevenueStream(), r.getCurrency()),
				LinkedHashMap::new, Collectors.toList()));
		for (GroupKey key : carry.keySet()) {
			groups.computeIfAbsent(key, k -> new Accumulator(k.currency));
		}

		List<AuthorRoyalty> results = new ArrayList<>();
		for (Map.Entry<GroupKey, Accumulator> entry : groups.entrySet()) {
			GroupKey key = entry.getKey();
			Accumulator acc = entry.getValue();
			List<AuthorRoyalty> carriedIn = carry.getOrDefault(key, List.of());

			Money carried = Money.zero(key.currency);
			for (AuthorRoyalty source : carriedIn) {
				carried = carried.add(source.getTotalDue());
			}
			Money payable = acc.payable(props.getRoyalty().getRoundingMode());
			Money threshold = configService.resolveThreshold(ConfigType.PAYOUT_THRESHOLD, key.currency.getCode(),
				period.lastInstant());
			RoyaltyStatus status = payable.add(carried).isLessThan(threshold) ? RoyaltyStatus.ACCRUED : RoyaltyStatus.PAYABLE;

			AuthorRoyalty record = existing.get(key);
			boolean created = record == null;
			if (created) {
				record = new AuthorRoyalty();
				record.setRoyaltyId(UUID.randomUUID());
				record.setAuthorRef(authorRef);
				record.setPeriodStart(period.getStart());
				record.setPeriodEnd(period.getEnd());
				record.setRevenueStream(key.stream);
				record.setCurrency(key.currency);
			}
			record.setGrossBase(acc.gross());
			record.setRateApplied(acc.rateApplied(payable));
			record.setPayable(payable);
			record.setCarried(carried);
			record.setStatus(status);
			record.setComputedAt(now);
			record.setSourceTransactionIds(acc.sources);

			if (created) {
				repository.insert(record);
			} else {
				repository.updateComputed(record);
			}
			repository.replaceSources(record.getRoyaltyId(), acc.sources);
			repository.markCarriedInto(carriedIn.stream().map(AuthorRoyalty::getRoyaltyId).collect(Collectors.toList()),
				record.getRoyaltyId());

			log.info("Royalty computed: author={} period={} stream={} gross={} payable={} carried={} status={}",
				authorRef, period, key.stream, record.getGrossBase(), payable, carried, status);
			results.add(record);
		}
		return results;
	}

	private List<AuthorRoyalty> correct(String authorRef, RoyaltyPeriod period) {
		Instant now = clock.instant();
		Map<GroupKey, Accumulator> groups = accumulate(authorRef, period);

		Map<GroupKey, AuthorRoyalty> originals = new LinkedHashMap<>();
		Map<GroupKey, Money> accountedPayable = new HashMap<>();
		Map<GroupKey, Money> accountedGross = new HashMap<>();
		for (AuthorRoyalty record : repository.findByAuthorPeriod(authorRef, period)) {
			GroupKey key = new GroupKey(record.getRevenueStream(), record.getCurrency());
			if (!record.isCorrection()) {
				originals.put(key, record);
			}
			accountedPayable.merge(key, record.getPayable(), Money::add);
			accountedGross.merge(key, record.getGrossBase(), Money::add);
		}
		for (GroupKey key : accountedPayable.keySet()) {
			groups.computeIfAbsent(key, k -> new Accumulator(k.currency));
		}

		List<AuthorRoyalty> written = new ArrayList<>();
		for (Map.Entry<GroupKey, Accumulator> entry : groups.entrySet()) {
			GroupKey key = entry.getKey();
			Accumulator acc = entry.getValue();
			Money payable = acc.payable(props.getRoyalty().getRoundingMode());
			Money payableDelta = payable.subtract(accountedPayable.getOrDefault(key, Money.zero(key.currency)));
			Money grossDelta = acc.gross().subtract(accountedGross.getOrDefault(key, Money.zero(key.currency)));
			if (payableDelta.isZero() && grossDelta.isZero()) {
				continue;
			}

			AuthorRoyalty original = originals.get(key);
			AuthorRoyalty correction = new AuthorRoyalty();
			correction.setRoyaltyId(UUID.randomUUID());
			correction.setAuthorRef(authorRef);
			correction.setPeriodStart(period.getStart());
			correction.setPeriodEnd(period.getEnd());
			correction.setRevenueStream(key.stream);
			correction.setCurrency(key.currency);
			correction.setGrossBase(grossDelta);
			correction.setRateApplied(acc.rateApplied(payable));
			correction.setPayable(payableDelta);
			correction.setCarried(Money.zero(key.currency));
			correction.setStatus(RoyaltyStatus.ACCRUED);
			// A stream that had no record at all becomes the period's original record
			correction.setCorrectionOf(original != null ? original.getRoyaltyId() : null);
			correction.setComputedAt(now);
			correction.setSourceTransactionIds(acc.sources);
			repository.insert(correction);
			repository.replaceSources(correction.getRoyaltyId(), acc.sources);

			log.info("Royalty correction appended: author={} period={} stream={} delta={} correctionOf={}",
				authorRef, period, key.stream, payableDelta, correction.getCorrectionOf());
			written.add(correction);
		}
		return written;
	}

	private Map<GroupKey, Accumulator> accumulate(String authorRef, RoyaltyPeriod period) {
		LedgerQuery query = LedgerQuery.create()
			.author(authorRef)
			.kinds(TransactionKind.CHARGE, TransactionKind.REFUND)
			.statuses(TransactionStatus.SETTLED, TransactionStatus.REVERSED)
			.settledBetween(period.startInstant(), period.endInstant());

		Map<GroupKey, Accumulator> groups = new LinkedHashMap<>();
		for (PaymentTransaction tx : ledger.query(query)) {
			if (!tx.isSettledCharge() && !tx.isMoneyReturned()) {
				continue;
			}
			RevenueStream stream = tx.getRevenueStream() != null ? tx.getRevenueStream() : RevenueStream.DIRECT_SALE;
			CurrencyCode currency = tx.getAmount().getCurrency();
			BigDecimal rate = configService.resolveRateOrDefault(ConfigType.ROYALTY_RATE, stream.getCode(), tx.getSettledAt());
			Money signed = tx.isMoneyReturned() ? tx.getAmount().negate() : tx.getAmount();
			groups.computeIfAbsent(new GroupKey(stream, currency), k -> new Accumulator(currency))
				.add(tx.getId(), signed, rate);
		}
		return groups;
	}

	private static final class GroupKey {
		private final RevenueStream stream;
		private final CurrencyCode currency;

		private GroupKey(RevenueStream stream, CurrencyCode currency) {
			this.stream = stream;
			this.currency = currency;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof GroupKey)) {
				return false;
			}
			GroupKey other = (GroupKey) o;
			return stream == other.stream && currency == other.currency;
		}

		@Override
		public int hashCode() {
			return Objects.hash(stream, currency);
		}
	}

	private static final class Accumulator {
		private final CurrencyCode currency;
		private final List<UUID> sources = new ArrayList<>();
		private long grossMinor;
		private BigDecimal exact = BigDecimal.ZERO;
		private BigDecimal uniformRate;
		private boolean mixedRates;

		private Accumulator(CurrencyCode currency) {
			this.currency = currency;
		}

		private void add(UUID transactionId, Money signedAmount, BigDecimal rate) {
			sources.add(transactionId);
			grossMinor = Math.addExact(grossMinor, signedAmount.getAmountMinorUnits());
			exact = exact.add(signedAmount.multiplyExact(rate));
			if (uniformRate == null) {
				uniformRate = rate;
			} else if (uniformRate.compareTo(rate) != 0) {
				mixedRates = true;
			}
		}

		private Money gross() {
			return Money.ofMinor(grossMinor, currency);
		}

		private Money payable(RoundingMode roundingMode) {
			return Money.ofMinor(exact.setScale(0, roundingMode).longValueExact(), currency);
		}

		private BigDecimal rateApplied(Money payable) {
			if (!mixedRates) {
				return uniformRate;
			}
			if (grossMinor == 0) {
				return null;
			}
			return BigDecimal.valueOf(payable.getAmountMinorUnits())
				.divide(BigDecimal.valueOf(grossMinor), EFFECTIVE_RATE_SCALE, RoundingMode.HALF_EVEN);
		}
	}
}
