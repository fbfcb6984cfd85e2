package io.coko.billing.subscription;

import io.coko.billing.ledger.PaymentProvider;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class SubscriptionRepository {

  private static final String SELECT_SUBSCRIPTION = """
    SELECT id, user_ref, plan_code, price_minor, currency, frequency, provider, payment_method_ref, status,
           resume_status, start_at, current_period_end, next_retry_at, failed_attempt_count, total_cycles,
           completed_cycles, version, claimed_at, created_at, updated_at
    FROM recurring_billing
    """;

  private static final String SELECT_ATTEMPT = """
    SELECT attempt_id, subscription_id, invoice_id, attempt_number, provider, provider_transaction_id,
           status, failure_code, created_at, updated_at
    FROM charge_attempt
    """;

  /**
   * Candidates for a renewal tick. The tick re-checks each one under its own claim.
   */
  public static final String DUE_WHERE_CLAUSE =
    "(status = 'ACTIVE' AND current_period_end <= :asOf AND (next_retry_at IS NULL OR next_retry_at <= :asOf)) " +
    "OR (status = 'PAST_DUE' AND next_retry_at <= :asOf) " +
    "OR (status = 'RENEWAL_PENDING' AND claimed_at <= :staleBefore)";

  private final JdbcTemplate jdbc;

  public SubscriptionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void insert(Subscription sub) {
    jdbc.update("""
      INSERT INTO recurring_billing
      (id, user_ref, plan_code, price_minor, currency, frequency, provider, payment_method_ref, status,
       resume_status, start_at, current_period_end, next_retry_at, failed_attempt_count, total_cycles,
       completed_cycles, version, claimed_at, created_at, updated_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """,
      sub.getSubscriptionId(),
      sub.getUserRef(),
      sub.getPlanCode(),
      sub.getPrice().getAmountMinorUnits(),
      sub.getPrice().getCurrency().getCode(),
      sub.getFrequency().getCode(),
      sub.getProvider().getCode(),
      sub.getPaymentMethodRef(),
      sub.getStatus().getCode(),
      sub.getResumeStatus() != null ? sub.getResumeStatus().getCode() : null,
      Timestamp.from(sub.getStartAt()),
      Timestamp.from(sub.getCurrentPeriodEnd()),
      toTimestamp(sub.getNextRetryAt()),
      sub.getFailedAttemptCount(),
      sub.getTotalCycles(),
      sub.getCompletedCycles(),
      sub.getVersion(),
      toTimestamp(sub.getClaimedAt()),
      Timestamp.from(sub.getCreatedAt()),
      Timestamp.from(sub.getUpdatedAt())
    );
  }

  public Optional<Subscription> findById(UUID id) {
    return jdbc.query(SELECT_SUBSCRIPTION + " WHERE id = ?", subscriptionMapper(), id).stream().findFirst();
  }

  public Optional<Subscription> findByIdForUpdate(UUID id) {
    return jdbc.query(SELECT_SUBSCRIPTION + " WHERE id = ? FOR UPDATE", subscriptionMapper(), id).stream().findFirst();
  }

  public List<Subscription> findByUserRef(String userRef) {
    return jdbc.query(SELECT_SUBSCRIPTION + " WHERE user_ref = ? ORDER BY created_at", subscriptionMapper(), userRef);
  }

  public List<UUID> findDueIds(Instant asOf, Instant staleBefore) {
    return jdbc.query(
      "SELECT id FROM recurring_billing WHERE " + DUE_WHERE_CLAUSE.replace(":asOf", "?").replace(":staleBefore", "?")
        + " ORDER BY id",
      (rs, i) -> rs.getObject(1, UUID.class),
      Timestamp.from(asOf), Timestamp.from(asOf), Timestamp.from(asOf), Timestamp.from(staleBefore));
  }

  /**
   * Optimistic claim for one renewal attempt.
   * @return true when this caller now owns the renewal
   */
  public boolean claim(UUID id, long expectedVersion, Instant now) {
    int updated = jdbc.update("""
      UPDATE recurring_billing
      SET resume_status = CASE WHEN status = 'RENEWAL_PENDING' THEN resume_status ELSE status END,
          status = 'RENEWAL_PENDING',
          claimed_at = ?,
          version = version + 1,
          updated_at = ?
      WHERE id = ? AND version = ? AND status IN ('ACTIVE', 'PAST_DUE', 'RENEWAL_PENDING')
      """,
      Timestamp.from(now), Timestamp.from(now), id, expectedVersion);
    return updated == 1;
  }

  /**
   * Write every mutable field. Callers hold the row lock.
   */
  public void update(Subscription sub, Instant now) {
    jdbc.update("""
      UPDATE recurring_billing
      SET status = ?, resume_status = ?, current_period_end = ?, next_retry_at = ?, failed_attempt_count = ?,
          completed_cycles = ?, payment_method_ref = ?, claimed_at = ?, version = version + 1, updated_at = ?
      WHERE id = ?
      """,
      sub.getStatus().getCode(),
      sub.getResumeStatus() != null ? sub.getResumeStatus().getCode() : null,
      Timestamp.from(sub.getCurrentPeriodEnd()),
      toTimestamp(sub.getNextRetryAt()),
      sub.getFailedAttemptCount(),
      sub.getCompletedCycles(),
      sub.getPaymentMethodRef(),
      toTimestamp(sub.getClaimedAt()),
      Timestamp.from(now),
      sub.getSubscriptionId()
    );
    sub.setVersion(sub.getVersion() + 1);
    sub.setUpdatedAt(now);
  }

  public void insertAttempt(ChargeAttempt attempt) {
    jdbc.update("""
      INSERT INTO charge_attempt
      (attempt_id, subscription_id, invoice_id, attempt_number, provider, provider_transaction_id,
       status, failure_code, created_at, updated_at)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      """,
      attempt.getAttemptId(),
      attempt.getSubscriptionId(),
      attempt.getInvoiceId(),
      attempt.getAttemptNumber(),
      attempt.getProvider().getCode(),
      attempt.getProviderTransactionId(),
      attempt.getStatus().name(),
      attempt.getFailureCode(),
      Timestamp.from(attempt.getCreatedAt()),
      Timestamp.from(attempt.getUpdatedAt())
    );
  }

  public void updateAttempt(UUID attemptId, ChargeAttemptStatus status, String providerTransactionId,
                            String failureCode, Instant now) {
    jdbc.update("""
      UPDATE charge_attempt
      SET status = ?, provider_transaction_id = COALESCE(?, provider_transaction_id), failure_code = ?, updated_at = ?
      WHERE attempt_id = ?
      """,
      status.name(), providerTransactionId, failureCode, Timestamp.from(now), attemptId);
  }

  public int settleUnresolvedAttempts(UUID subscriptionId, UUID invoiceId, Instant now) {
    return jdbc.update("""
      UPDATE charge_attempt SET status = 'SETTLED', failure_code = NULL, updated_at = ?
      WHERE subscription_id = ? AND invoice_id = ? AND status IN ('PENDING', 'ERROR')
      """,
      Timestamp.from(now), subscriptionId, invoiceId);
  }

  public Optional<ChargeAttempt> findLatestAttempt(UUID subscriptionId) {
    return jdbc.query(SELECT_ATTEMPT + " WHERE subscription_id = ? ORDER BY attempt_number DESC LIMIT 1",
        attemptMapper(), subscriptionId)
      .stream().findFirst();
  }

  public List<ChargeAttempt> findAttempts(UUID subscriptionId) {
    return jdbc.query(SELECT_ATTEMPT + " WHERE subscription_id = ? ORDER BY attempt_number", attemptMapper(), subscriptionId);
  }

  public int countAttempts(UUID subscriptionId) {
    Integer count = jdbc.queryForObject(
      "SELECT COUNT(1) FROM charge_attempt WHERE subscription_id = ?", Integer.class, subscriptionId);
    return count != null ? count : 0;
  }

  private static RowMapper<Subscription> subscriptionMapper() {
    return (rs, rowNum) -> {
      Subscription sub = new Subscription();
      sub.setSubscriptionId(rs.getObject("id", UUID.class));
      sub.setUserRef(rs.getString("user_ref"));
      sub.setPlanCode(rs.getString("plan_code"));
      sub.setPrice(Money.ofMinor(rs.getLong("price_minor"), CurrencyCode.fromCode(rs.getString("currency"))));
      sub.setFrequency(BillingFrequency.fromCode(rs.getString("frequency")));
      sub.setProvider(PaymentProvider.fromCode(rs.getString("provider")));
      sub.setPaymentMethodRef(rs.getString("payment_method_ref"));
      sub.setStatus(SubscriptionStatus.fromCode(rs.getString("status")));
      sub.setResumeStatus(SubscriptionStatus.fromCode(rs.getString("resume_status")));
      sub.setStartAt(toInstant(rs.getTimestamp("start_at")));
      sub.setCurrentPeriodEnd(toInstant(rs.getTimestamp("current_period_end")));
      sub.setNextRetryAt(toInstant(rs.getTimestamp("next_retry_at")));
      sub.setFailedAttemptCount(rs.getInt("failed_attempt_count"));
      sub.setTotalCycles(rs.getObject("total_cycles") != null ? rs.getInt("total_cycles") : null);
      sub.setCompletedCycles(rs.getInt("completed_cycles"));
      sub.setVersion(rs.getLong("version"));
      sub.setClaimedAt(toInstant(rs.getTimestamp("claimed_at")));
      sub.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
      sub.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
      return sub;
    };
  }

  private static RowMapper<ChargeAttempt> attemptMapper() {
    return (rs, rowNum) -> {
      ChargeAttempt attempt = new ChargeAttempt();
      attempt.setAttemptId(rs.getObject("attempt_id", UUID.class));
      attempt.setSubscriptionId(rs.getObject("subscription_id", UUID.class));
      attempt.setInvoiceId(rs.getObject("invoice_id", UUID.class));
      attempt.setAttemptNumber(rs.getInt("attempt_number"));
      attempt.setProvider(PaymentProvider.fromCode(rs.getString("provider")));
      attempt.setProviderTransactionId(rs.getString("provider_transaction_id"));
      attempt.setStatus(ChargeAttemptStatus.valueOf(rs.getString("status")));
      attempt.setFailureCode(rs.getString("failure_code"));
      attempt.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
      attempt.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
      return attempt;
    };
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }
}
