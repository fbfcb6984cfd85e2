package io.coko.billing.invoice;

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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
public class InvoiceRepository {

  private static final Logger log = LoggerFactory.getLogger(InvoiceRepository.class);

  private static final String SELECT_INVOICE = """
    SELECT id, billing_entity, sequence_number, invoice_number, user_ref, currency, discount_minor, total_minor, status,
           subscription_id, source_transaction_id, period_start, period_end, issued_at, due_at, paid_at, voided_at,
           void_reason, created_at
    FROM invoice
    """;

  private final JdbcTemplate jdbc;

  public InvoiceRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  /**
   * Make sure the numbering row of an entity exists. Runs outside the invoice transaction;
   * a concurrent creator inserting the same row is harmless.
   */
  public void ensureSequenceRow(String billingEntity) {
    Integer existing = jdbc.queryForObject(
      "SELECT COUNT(1) FROM invoice_sequence WHERE billing_entity = ?", Integer.class, billingEntity);
    if (existing != null && existing > 0) {
      return;
    }
    try {
      jdbc.update("INSERT INTO invoice_sequence (billing_entity, last_value) VALUES (?, 0)", billingEntity);
    } catch (DuplicateKeyException e) {
      log.debug("Invoice sequence row created concurrently: entity={}", billingEntity);
    }
  }

  /**
   * Allocate the next number. The UPDATE row lock is held until the surrounding transaction ends,
   * which serializes creators of one entity.
   */
  public long nextSequenceNumber(String billingEntity) {
    int updated = jdbc.update(
      "UPDATE invoice_sequence SET last_value = last_value + 1 WHERE billing_entity = ?", billingEntity);
    if (updated == 0) {
      throw new IllegalStateException("No invoice sequence row for billing entity " + billingEntity);
    }
    Long value = jdbc.queryForObject(
      "SELECT last_value FROM invoice_sequence WHERE billing_entity = ?", Long.class, billingEntity);
    return value != null ? value : 0L;
  }

  public void insert(Invoice invoice) {
    jdbc.update("""
      INSERT INTO invoice
      (id, billing_entity, sequence_number, invoice_number, user_ref, currency, discount_minor, total_minor, status,
       subscription_id, source_transaction_id, period_start, period_end, created_at, updated_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """,
      invoice.getInvoiceId(),
      invoice.getBillingEntity(),
      invoice.getSequenceNumber(),
      invoice.getInvoiceNumber(),
      invoice.getUserRef(),
      invoice.getCurrency().getCode(),
      invoice.getDiscount().getAmountMinorUnits(),
      invoice.getStoredTotal().getAmountMinorUnits(),
      invoice.getStatus().getCode(),
      invoice.getSubscriptionId(),
      invoice.getSourceTransactionId(),
      toTimestamp(invoice.getPeriodStart()),
      toTimestamp(invoice.getPeriodEnd()),
      Timestamp.from(invoice.getCreatedAt()),
      Timestamp.from(invoice.getCreatedAt())
    );
    int lineNo = 1;
    for (InvoiceItem item : invoice.getItems()) {
      jdbc.update("""
        INSERT INTO invoice_item
        (id, invoice_id, line_no, description, quantity, unit_price_minor, currency, item_type, author_ref)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
        UUID.randomUUID(),
        invoice.getInvoiceId(),
        lineNo++,
        item.getDescription(),
        item.getQuantity(),
        item.getUnitPrice().getAmountMinorUnits(),
        item.getUnitPrice().getCurrency().getCode(),
        item.getItemType().getCode(),
        item.getAuthorRef()
      );
    }
  }

  public int markIssued(UUID invoiceId, Instant issuedAt, Instant dueAt) {
    return jdbc.update(
      "UPDATE invoice SET status = 'ISSUED', issued_at = ?, due_at = ?, updated_at = ? WHERE id = ? AND status = 'DRAFT'",
      Timestamp.from(issuedAt), Timestamp.from(dueAt), Timestamp.from(issuedAt), invoiceId);
  }

  public int markPaid(UUID invoiceId, Instant paidAt) {
    return jdbc.update(
      "UPDATE invoice SET status = 'PAID', paid_at = ?, updated_at = ? WHERE id = ? AND status IN ('ISSUED', 'OVERDUE')",
      Timestamp.from(paidAt), Timestamp.from(paidAt), invoiceId);
  }

  public int markOverdue(UUID invoiceId, Instant now) {
    return jdbc.update(
      "UPDATE invoice SET status = 'OVERDUE', updated_at = ? WHERE id = ? AND status = 'ISSUED'",
      Timestamp.from(now), invoiceId);
  }

  public int markVoid(UUID invoiceId, String reason, Instant now) {
    return jdbc.update(
      "UPDATE invoice SET status = 'VOID', voided_at = ?, void_reason = ?, updated_at = ? " +
      "WHERE id = ? AND status IN ('DRAFT', 'ISSUED', 'OVERDUE')",
      Timestamp.from(now), reason, Timestamp.from(now), invoiceId);
  }

  public Optional<Invoice> findById(UUID invoiceId) {
    return jdbc.query(SELECT_INVOICE + " WHERE id = ?", invoiceMapper(), invoiceId)
      .stream().findFirst().map(this::withItems);
  }

  /**
   * Load and row-lock an invoice for the rest of the current transaction.
   */
  public Optional<Invoice> findByIdForUpdate(UUID invoiceId) {
    return jdbc.query(SELECT_INVOICE + " WHERE id = ? FOR UPDATE", invoiceMapper(), invoiceId)
      .stream().findFirst().map(this::withItems);
  }

  public List<Invoice> findByUserRef(String userRef) {
    List<Invoice> invoices = jdbc.query(
      SELECT_INVOICE + " WHERE user_ref = ? ORDER BY created_at DESC, sequence_number DESC", invoiceMapper(), userRef);
    invoices.forEach(this::withItems);
    return invoices;
  }

  public Optional<Invoice> findBySubscriptionPeriod(UUID subscriptionId, Instant periodStart) {
    return jdbc.query(SELECT_INVOICE + " WHERE subscription_id = ? AND period_start = ?",
        invoiceMapper(), subscriptionId, Timestamp.from(periodStart))
      .stream().findFirst().map(this::withItems);
  }

  public List<Invoice> findOpenBySubscription(UUID subscriptionId) {
    List<Invoice> invoices = jdbc.query(
      SELECT_INVOICE + " WHERE subscription_id = ? AND status IN ('ISSUED', 'OVERDUE') ORDER BY period_start",
      invoiceMapper(), subscriptionId);
    invoices.forEach(this::withItems);
    return invoices;
  }

  public List<UUID> findIssuedDueBefore(Instant asOf) {
    return jdbc.query(
      "SELECT id FROM invoice WHERE status = 'ISSUED' AND due_at < ? ORDER BY due_at",
      (rs, i) -> rs.getObject(1, UUID.class),
      Timestamp.from(asOf));
  }

  public List<UUID> findPaidIds() {
    return jdbc.query("SELECT id FROM invoice WHERE status = 'PAID'", (rs, i) -> rs.getObject(1, UUID.class));
  }

  public Optional<Invoice> findBySourceTransaction(UUID transactionId) {
    return jdbc.query(SELECT_INVOICE + " WHERE source_transaction_id = ?", invoiceMapper(), transactionId)
      .stream().findFirst().map(this::withItems);
  }

  /**
   * One row per status and currency: {@code status, currency, cnt, total_minor}.
   */
  public List<Map<String, Object>> statistics(String userRef) {
    String sql = "SELECT status, currency, COUNT(1) AS cnt, COALESCE(SUM(total_minor), 0) AS total_minor FROM invoice";
    if (userRef == null) {
      return jdbc.queryForList(sql + " GROUP BY status, currency ORDER BY status, currency");
    }
    return jdbc.queryForList(sql + " WHERE user_ref = ? GROUP BY status, currency ORDER BY status, currency", userRef);
  }

  public List<InvoiceItem> findItems(UUID invoiceId) {
    return jdbc.query("""
      SELECT description, quantity, unit_price_minor, currency, item_type, author_ref
      FROM invoice_item WHERE invoice_id = ? ORDER BY line_no
      """,
      (rs, i) -> new InvoiceItem(
        rs.getString("description"),
        rs.getInt("quantity"),
        Money.ofMinor(rs.getLong("unit_price_minor"), CurrencyCode.fromCode(rs.getString("currency"))),
        ItemType.fromCode(rs.getString("item_type")),
        rs.getString("author_ref")),
      invoiceId);
  }

  private Invoice withItems(Invoice invoice) {
    invoice.setItems(new ArrayList<>(findItems(invoice.getInvoiceId())));
    return invoice;
  }

  private static RowMapper<Invoice> invoiceMapper() {
    return (rs, rowNum) -> {
      Invoice invoice = new Invoice();
      CurrencyCode currency = CurrencyCode.fromCode(rs.getString("currency"));
      invoice.setInvoiceId(rs.getObject("id", UUID.class));
      invoice.setBillingEntity(rs.getString("billing_entity"));
      invoice.setSequenceNumber(rs.getLong("sequence_number"));
      invoice.setInvoiceNumber(rs.getString("invoice_number"));
      invoice.setUserRef(rs.getString("user_ref"));
      invoice.setCurrency(currency);
      invoice.setDiscount(Money.ofMinor(rs.getLong("discount_minor"), currency));
      invoice.setStoredTotal(Money.ofMinor(rs.getLong("total_minor"), currency));
      invoice.setStatus(InvoiceStatus.fromCode(rs.getString("status")));
      invoice.setSubscriptionId(rs.getObject("subscription_id", UUID.class));
      invoice.setSourceTransactionId(rs.getObject("source_transaction_id", UUID.class));
      invoice.setPeriodStart(toInstant(rs.getTimestamp("period_start")));
      invoice.setPeriodEnd(toInstant(rs.getTimestamp("period_end")));
      invoice.setIssuedAt(toInstant(rs.getTimestamp("issued_at")));
      invoice.setDueAt(toInstant(rs.getTimestamp("due_at")));
      invoice.setPaidAt(toInstant(rs.getTimestamp("paid_at")));
      invoice.setVoidedAt(toInstant(rs.getTimestamp("voided_at")));
      invoice.setVoidReason(rs.getString("void_reason"));
      invoice.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
      return invoice;
    };
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }
}
