package io.coko.billing.ledger;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only ledger of payment transactions.
 *
 * {@link #ingest} is the idempotency boundary of the whole engine: the table carries a unique
 * constraint on (provider, provider_transaction_id) and a second insert of the same key is
 * reported as {@link IngestOutcome#DUPLICATE}. No read-before-write: of two concurrent
 * deliveries of one event exactly one inserts.
 */
@Repository
public class LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, provider, provider_transaction_id, amount_minor, currency, kind, status,
               subject_type, subject_id, author_ref, payer_ref, revenue_stream, failure_code,
               related_provider_transaction_id, created_at, settled_at
        FROM payment_transaction
        """;

    private final JdbcTemplate jdbc;

    public LedgerStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public IngestOutcome ingest(PaymentTransaction tx) {
        try {
            jdbc.update("""
                INSERT INTO payment_transaction
                (id, provider, provider_transaction_id, amount_minor, currency, kind, status,
                 subject_type, subject_id, author_ref, payer_ref, revenue_stream, failure_code,
                 related_provider_transaction_id, created_at, settled_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                tx.getId(),
                tx.getProvider().getCode(),
                tx.getProviderTransactionId(),
                tx.getAmount().getAmountMinorUnits(),
                tx.getAmount().getCurrency().getCode(),
                tx.getKind().getCode(),
                tx.getStatus().getCode(),
                tx.getSubjectRef() != null ? tx.getSubjectRef().getType().name() : null,
                tx.getSubjectRef() != null ? tx.getSubjectRef().getId() : null,
                tx.getAuthorRef(),
                tx.getPayerRef(),
                tx.getRevenueStream() != null ? tx.getRevenueStream().getCode() : null,
                tx.getFailureCode(),
                tx.getRelatedProviderTransactionId(),
                Timestamp.from(tx.getCreatedAt()),
                tx.getSettledAt() != null ? Timestamp.from(tx.getSettledAt()) : null
            );
            log.info("Ledger insert: id={} ref={} kind={} status={} amount={}",
                tx.getId(), tx.getExternalRef(), tx.getKind(), tx.getStatus(), tx.getAmount());
            return IngestOutcome.INSERTED;
        } catch (DuplicateKeyException e) {
            log.info("Ledger duplicate ignored: ref={}", tx.getExternalRef());
            return IngestOutcome.DUPLICATE;
        } catch (ConcurrencyFailureException e) {
            // Some databases report a racing unique insert as a lock conflict instead of a key violation
            if (findByExternalRef(tx.getExternalRef()).isPresent()) {
                log.info("Ledger duplicate ignored after concurrent insert: ref={}", tx.getExternalRef());
                return IngestOutcome.DUPLICATE;
            }
            throw e;
        }
    }

    public Optional<PaymentTransaction> findById(UUID id) {
        return jdbc.query(SELECT_COLUMNS + " WHERE id = ?", rowMapper(), id).stream().findFirst();
    }

    public Optional<PaymentTransaction> findByExternalRef(ExternalRef ref) {
        return jdbc.query(SELECT_COLUMNS + " WHERE provider = ? AND provider_transaction_id = ?",
                rowMapper(), ref.getProvider().getCode(), ref.getProviderTransactionId())
            .stream().findFirst();
    }

    public List<PaymentTransaction> query(LedgerQuery query) {
        List<Object> args = new ArrayList<>();
        String sql = buildSql(query, args);
        return jdbc.query(sql, rowMapper(), args.toArray());
    }

    /**
     * Lazily streams matching rows. The caller must close the stream.
     */
    public Stream<PaymentTransaction> stream(LedgerQuery query) {
        List<Object> args = new ArrayList<>();
        String sql = buildSql(query, args);
        return jdbc.queryForStream(sql, rowMapper(), args.toArray());
    }

    /**
     * Net amount applied to a subject: settled charges minus refunds and chargebacks,
     * counting only transactions in the given currency.
     */
    public Money sumApplied(SubjectRef subject, CurrencyCode currency) {
        Long total = jdbc.queryForObject("""
            SELECT COALESCE(SUM(CASE
                     WHEN kind = 'CHARGE' AND status = 'SETTLED' THEN amount_minor
                     WHEN kind = 'REFUND' AND status IN ('SETTLED', 'REVERSED') THEN -amount_minor
                     ELSE 0 END), 0)
            FROM payment_transaction
            WHERE subject_type = ? AND subject_id = ? AND currency = ?
            """,
            Long.class,
            subject.getType().name(), subject.getId(), currency.getCode()
        );
        return Money.ofMinor(total != null ? total : 0L, currency);
    }

    /**
     * Authors with settled charges, refunds or chargebacks in {@code [from, before)}.
     */
    public List<String> distinctAuthors(Instant from, Instant before) {
        return jdbc.queryForList("""
            SELECT DISTINCT author_ref FROM payment_transaction
            WHERE author_ref IS NOT NULL
              AND kind IN ('CHARGE', 'REFUND')
              AND status IN ('SETTLED', 'REVERSED')
              AND settled_at >= ? AND settled_at < ?
            ORDER BY author_ref
            """,
            String.class, Timestamp.from(from), Timestamp.from(before));
    }

    private String buildSql(LedgerQuery query, List<Object> args) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        if (query.getProvider() != null) {
            where.append(" AND provider = ?");
            args.add(query.getProvider().getCode());
        }
        if (query.getSubjectRef() != null) {
            where.append(" AND subject_type = ? AND subject_id = ?");
            args.add(query.getSubjectRef().getType().name());
            args.add(query.getSubjectRef().getId());
        }
        if (query.getAuthorRef() != null) {
            where.append(" AND author_ref = ?");
            args.add(query.getAuthorRef());
        }
        if (!query.getKinds().isEmpty()) {
            where.append(" AND kind IN (")
                .append(query.getKinds().stream().map(k -> "?").collect(Collectors.joining(", ")))
                .append(")");
            query.getKinds().forEach(k -> args.add(k.getCode()));
        }
        if (!query.getStatuses().isEmpty()) {
            where.append(" AND status IN (")
                .append(query.getStatuses().stream().map(s -> "?").collect(Collectors.joining(", ")))
                .append(")");
            query.getStatuses().forEach(s -> args.add(s.getCode()));
        }
        if (query.getSettledFrom() != null) {
            where.append(" AND settled_at >= ?");
            args.add(Timestamp.from(query.getSettledFrom()));
        }
        if (query.getSettledBefore() != null) {
            where.append(" AND settled_at < ?");
            args.add(Timestamp.from(query.getSettledBefore()));
        }
        return SELECT_COLUMNS + where + " ORDER BY created_at, id";
    }

    private RowMapper<PaymentTransaction> rowMapper() {
        return (rs, rowNum) -> {
            PaymentTransaction.Builder builder = PaymentTransaction.builder()
                .id(rs.getObject("id", UUID.class))
                .externalRef(PaymentProvider.fromCode(rs.getString("provider")), rs.getString("provider_transaction_id"))
                .amount(Money.ofMinor(rs.getLong("amount_minor"), CurrencyCode.fromCode(rs.getString("currency"))))
                .kind(TransactionKind.fromCode(rs.getString("kind")))
                .status(TransactionStatus.fromCode(rs.getString("status")))
                .authorRef(rs.getString("author_ref"))
                .payerRef(rs.getString("payer_ref"))
                .revenueStream(RevenueStream.fromCode(rs.getString("revenue_stream")))
                .failureCode(rs.getString("failure_code"))
                .relatedProviderTransactionId(rs.getString("related_provider_transaction_id"))
                .createdAt(rs.getTimestamp("created_at").toInstant());
            String subjectType = rs.getString("subject_type");
            UUID subjectId = rs.getObject("subject_id", UUID.class);
            if (subjectType != null && subjectId != null) {
                builder.subjectRef(SubjectRef.Type.valueOf(subjectType) == SubjectRef.Type.INVOICE
                    ? SubjectRef.invoice(subjectId) : SubjectRef.subscription(subjectId));
            }
            Timestamp settledAt = rs.getTimestamp("settled_at");
            if (settledAt != null) {
                builder.settledAt(settledAt.toInstant());
            }
            return builder.build();
        };
    }
}
