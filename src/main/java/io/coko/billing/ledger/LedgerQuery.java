package io.coko.billing.ledger;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Filter for ledger reads. Unset fields do not constrain the result.
 * The settled-at window is half-open: {@code [settledFrom, settledBefore)}.
 */
public class LedgerQuery {

    private PaymentProvider provider;
    private SubjectRef subjectRef;
    private String authorRef;
    private Set<TransactionKind> kinds = EnumSet.noneOf(TransactionKind.class);
    private Set<TransactionStatus> statuses = EnumSet.noneOf(TransactionStatus.class);
    private Instant settledFrom;
    private Instant settledBefore;

    public static LedgerQuery create() {
        return new LedgerQuery();
    }

    public LedgerQuery provider(PaymentProvider provider) {
        this.provider = provider;
        return this;
    }

    public LedgerQuery subject(SubjectRef subjectRef) {
        this.subjectRef = subjectRef;
        return this;
    }

    public LedgerQuery author(String authorRef) {
        this.authorRef = authorRef;
        return this;
    }

    public LedgerQuery kinds(TransactionKind first, TransactionKind... rest) {
        this.kinds = EnumSet.of(first, rest);
        return this;
    }

    public LedgerQuery statuses(TransactionStatus first, TransactionStatus... rest) {
        this.statuses = EnumSet.of(first, rest);
        return this;
    }

    public LedgerQuery settledBetween(Instant from, Instant before) {
        this.settledFrom = from;
        this.settledBefore = before;
        return this;
    }

    public PaymentProvider getProvider() {
        return provider;
    }

    public SubjectRef getSubjectRef() {
        return subjectRef;
    }

    public String getAuthorRef() {
        return authorRef;
    }

    public Set<TransactionKind> getKinds() {
        return kinds;
    }

    public Set<TransactionStatus> getStatuses() {
        return statuses;
    }

    public Instant getSettledFrom() {
        return settledFrom;
    }

    public Instant getSettledBefore() {
        return settledBefore;
    }
}
