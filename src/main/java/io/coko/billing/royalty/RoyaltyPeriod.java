package io.coko.billing.royalty;

import io.coko.billing.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Half-open range of UTC calendar days {@code [start, end)}.
 */
public final class RoyaltyPeriod {

    private final LocalDate start;
    private final LocalDate end;

    private RoyaltyPeriod(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    public static RoyaltyPeriod of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("Royalty period needs a start and an end");
        }
        if (!start.isBefore(end)) {
            throw new ValidationException("Royalty period start must be before its end", "start", start);
        }
        return new RoyaltyPeriod(start, end);
    }

    public static RoyaltyPeriod ofMonth(YearMonth month) {
        return new RoyaltyPeriod(month.atDay(1), month.plusMonths(1).atDay(1));
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public Instant startInstant() {
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant endInstant() {
        return end.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Last instant inside the period, for lookups that must not see what takes effect at {@link #endInstant()}.
     */
    public Instant lastInstant() {
        return endInstant().minusNanos(1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoyaltyPeriod)) {
            return false;
        }
        RoyaltyPeriod other = (RoyaltyPeriod) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
