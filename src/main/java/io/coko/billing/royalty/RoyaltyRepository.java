package io.coko.billing.royalty;

import io.coko.billing.ledger.RevenueStream;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class RoyaltyRepository {

  private static final Logger log = LoggerFactory.getLogger(RoyaltyRepository.class);

  private static final String SELECT_ROYALTY = """
    SELECT id, author_ref, period_start, period_end, revenue_stream, currency, gross_base_minor, rate_applied,
           payable_minor, carried_minor, status, correction_of, carried_into, invoice_id, payout_transaction_id, paid_at,
           computed_at
    FROM author_royalty
    """;

  // paid, invoiced or carried forward
  private static final String CLOSED = "(status IN ('PAID', 'INVOICED') OR carried_into IS NOT NULL)";

  private final JdbcTemplate jdbc;

  public RoyaltyRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void ensureLockRow(String authorRef, RoyaltyPeriod period) {
    Integer existing = jdbc.queryForObject(
      "SELECT COUNT(1) FROM royalty_period_lock WHERE author_ref = ? AND period_start = ? AND period_end = ?",
      Integer.class, authorRef, period.getStart(), period.getEnd());
    if (existing != null && existing > 0) {
      return;
    }
    try {
      jdbc.update("INSERT INTO royalty_period_lock (author_ref, period_start, period_end) VALUES (?, ?, ?)",
        authorRef, period.getStart(), period.getEnd());
    } catch (DuplicateKeyException e) {
      log.debug("Royalty lock row created concurrently: author={} period={}", authorRef, period);
    }
  }

  /**
   * Serializes computations for one author and period until the surrounding transaction ends.
   */
  public void lockAuthorPeriod(String authorRef, RoyaltyPeriod period) {
    jdbc.query(
      "SELECT author_ref FROM royalty_period_lock WHERE author_ref = ? AND period_start = ? AND period_end = ? FOR UPDATE",
      (rs, i) -> rs.getString(1), authorRef, period.getStart(), period.getEnd());
  }

  /**
   * Whether any record of the period is paid, invoiced or carried forward.
   */
  public boolean anyClosed(RoyaltyPeriod period) {
    Integer count = jdbc.queryForObject(
      "SELECT COUNT(1) FROM author_royalty WHERE " + CLOSED + " AND period_start = ? AND period_end = ?",
      Integer.class, period.getStart(), period.getEnd());
    return count != null && count > 0;
  }

  public boolean anyClosed(String authorRef, RoyaltyPeriod period) {
    Integer count = jdbc.queryForObject(
      "SELECT COUNT(1) FROM author_royalty WHERE " + CLOSED + " AND author_ref = ? AND period_start = ? AND period_end = ?",
      Integer.class, authorRef, period.getStart(), period.getEnd());
    return count != null && count > 0;
  }

  public List<String> findAuthorsWithPeriodRecords(RoyaltyPeriod period) {
    return jdbc.queryForList(
      "SELECT DISTINCT author_ref FROM author_royalty WHERE period_start = ? AND period_end = ? ORDER BY author_ref",
      String.class, period.getStart(), period.getEnd());
  }

  /**
   * Authors holding accrued amounts from periods ending on or before {@code before}
   * that no later record has picked up yet.
   */
  public List<String> findAuthorsWithOpenCarry(LocalDate before) {
    return jdbc.queryForList(
      "SELECT DISTINCT author_ref FROM author_royalty " +
      "WHERE status = 'ACCRUED' AND carried_into IS NULL AND period_end <= ? ORDER BY author_ref",
      String.class, before);
  }

  public List<AuthorRoyalty> findOpenCarry(String authorRef, LocalDate before) {
    return jdbc.query(SELECT_ROYALTY +
        " WHERE author_ref = ? AND status = 'ACCRUED' AND carried_into IS NULL AND period_end <= ?" +
        " ORDER BY period_start, computed_at",
      royaltyMapper(), authorRef, before);
  }

  public List<AuthorRoyalty> findByAuthorPeriod(String authorRef, RoyaltyPeriod period) {
    return jdbc.query(SELECT_ROYALTY +
        " WHERE author_ref = ? AND period_start = ? AND period_end = ? ORDER BY revenue_stream, currency, computed_at",
      royaltyMapper(), authorRef, period.getStart(), period.getEnd());
  }

  public List<AuthorRoyalty> findByAuthor(String authorRef) {
    return jdbc.query(SELECT_ROYALTY + " WHERE author_ref = ? ORDER BY period_start, revenue_stream, currency",
      royaltyMapper(), authorRef);
  }

  public Optional<AuthorRoyalty> findById(UUID royaltyId) {
    return jdbc.query(SELECT_ROYALTY + " WHERE id = ?", royaltyMapper(), royaltyId).stream().findFirst()
      .map(this::withSources);
  }

  public Optional<AuthorRoyalty> findByIdForUpdate(UUID royaltyId) {
    return jdbc.query(SELECT_ROYALTY + " WHERE id = ? FOR UPDATE", royaltyMapper(), royaltyId).stream().findFirst();
  }

  public void insert(AuthorRoyalty royalty) {
    jdbc.update("""
      INSERT INTO author_royalty
      (id, author_ref, period_start, period_end, revenue_stream, currency, gross_base_minor, rate_applied,
       payable_minor, carried_minor, status, correction_of, carried_into, invoice_id, payout_transaction_id, paid_at,
       computed_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """,
      royalty.getRoyaltyId(),
      royalty.getAuthorRef(),
      royalty.getPeriodStart(),
      royalty.getPeriodEnd(),
      royalty.getRevenueStream().getCode(),
      royalty.getCurrency().getCode(),
      royalty.getGrossBase().getAmountMinorUnits(),
      royalty.getRateApplied(),
      royalty.getPayable().getAmountMinorUnits(),
      royalty.getCarried().getAmountMinorUnits(),
      royalty.getStatus().name(),
      royalty.getCorrectionOf(),
      royalty.getCarriedInto(),
      royalty.getInvoiceId(),
      royalty.getPayoutTransactionId(),
      toTimestamp(royalty.getPaidAt()),
      Timestamp.from(royalty.getComputedAt())
    );
  }

  /**
   * Overwrite the computed figures of a record that is still open: not paid, not invoiced, not carried forward.
   */
  public int updateComputed(AuthorRoyalty royalty) {
    return jdbc.update("""
      UPDATE author_royalty
      SET gross_base_minor = ?, rate_applied = ?, payable_minor = ?, carried_minor = ?, status = ?, computed_at = ?
      WHERE id = ? AND status IN ('ACCRUED', 'PAYABLE') AND carried_into IS NULL
      """,
      royalty.getGrossBase().getAmountMinorUnits(),
      royalty.getRateApplied(),
      royalty.getPayable().getAmountMinorUnits(),
      royalty.getCarried().getAmountMinorUnits(),
      royalty.getStatus().name(),
      Timestamp.from(royalty.getComputedAt()),
      royalty.getRoyaltyId());
  }

  public int releaseCarriedInto(UUID royaltyId) {
    return jdbc.update("UPDATE author_royalty SET carried_into = NULL WHERE carried_into = ?", royaltyId);
  }

  public void markCarriedInto(List<UUID> royaltyIds, UUID intoId) {
    for (UUID id : royaltyIds) {
      jdbc.update("UPDATE author_royalty SET carried_into = ? WHERE id = ?", intoId, id);
    }
  }

  public int markPaid(UUID royaltyId, UUID payoutTransactionId, Instant paidAt) {
    return jdbc.update(
      "UPDATE author_royalty SET status = 'PAID', payout_transaction_id = ?, paid_at = ? " +
      "WHERE id = ? AND status IN ('PAYABLE', 'INVOICED')",
      payoutTransactionId, Timestamp.from(paidAt), royaltyId);
  }

  public void markInvoiced(List<UUID> royaltyIds, UUID invoiceId) {
    for (UUID id : royaltyIds) {
      jdbc.update("UPDATE author_royalty SET status = 'INVOICED', invoice_id = ? WHERE id = ? AND status = 'PAYABLE'",
        invoiceId, id);
    }
  }

  public int countUnpaidOnInvoice(UUID invoiceId) {
    Integer count = jdbc.queryForObject(
      "SELECT COUNT(1) FROM author_royalty WHERE invoice_id = ? AND status <> 'PAID'", Integer.class, invoiceId);
    return count != null ? count : 0;
  }

  public void replaceSources(UUID royaltyId, List<UUID> transactionIds) {
    jdbc.update("DELETE FROM royalty_source_transaction WHERE royalty_id = ?", royaltyId);
    for (UUID txId : transactionIds) {
      jdbc.update("INSERT INTO royalty_source_transaction (royalty_id, transaction_id) VALUES (?, ?)", royaltyId, txId);
    }
  }

  public List<UUID> findSources(UUID royaltyId) {
    return jdbc.query("SELECT transaction_id FROM royalty_source_transaction WHERE royalty_id = ? ORDER BY transaction_id",
      (rs, i) -> rs.getObject(1, UUID.class), royaltyId);
  }

  private AuthorRoyalty withSources(AuthorRoyalty royalty) {
    royalty.setSourceTransactionIds(findSources(royalty.getRoyaltyId()));
    return royalty;
  }

  private static RowMapper<AuthorRoyalty> royaltyMapper() {
    return (rs, rowNum) -> {
      AuthorRoyalty r = new AuthorRoyalty();
      CurrencyCode currency = CurrencyCode.fromCode(rs.getString("currency"));
      r.setRoyaltyId(rs.getObject("id", UUID.class));
      r.setAuthorRef(rs.getString("author_ref"));
      r.setPeriodStart(rs.getObject("period_start", LocalDate.class));
      r.setPeriodEnd(rs.getObject("period_end", LocalDate.class));
      r.setRevenueStream(RevenueStream.fromCode(rs.getString("revenue_stream")));
      r.setCurrency(currency);
      r.setGrossBase(Money.ofMinor(rs.getLong("gross_base_minor"), currency));
      r.setRateApplied(rs.getBigDecimal("rate_applied"));
      r.setPayable(Money.ofMinor(rs.getLong("payable_minor"), currency));
      r.setCarried(Money.ofMinor(rs.getLong("carried_minor"), currency));
      r.setStatus(RoyaltyStatus.valueOf(rs.getString("status")));
      r.setCorrectionOf(rs.getObject("correction_of", UUID.class));
      r.setCarriedInto(rs.getObject("carried_into", UUID.class));
      r.setInvoiceId(rs.getObject("invoice_id", UUID.class));
      r.setPayoutTransactionId(rs.getObject("payout_transaction_id", UUID.class));
      Timestamp paidAt = rs.getTimestamp("paid_at");
      r.setPaidAt(paidAt != null ? paidAt.toInstant() : null);
      r.setComputedAt(rs.getTimestamp("computed_at").toInstant());
      return r;
    };
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }
}
