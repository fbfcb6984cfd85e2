package io.coko.billing.money;

import io.coko.billing.exception.CurrencyMismatchException;
import io.coko.billing.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Exact amount of money in integer minor units of a single currency.
 * Immutable. Arithmetic across currencies and long overflow both fail fast.
 */
public final class Money implements Comparable<Money> {

    private final long amountMinorUnits;
    private final CurrencyCode currency;

    private Money(long amountMinorUnits, CurrencyCode currency) {
        this.amountMinorUnits = amountMinorUnits;
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Money ofMinor(long amountMinorUnits, CurrencyCode currency) {
        return new Money(amountMinorUnits, currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(0L, currency);
    }

    /**
     * Converts a major-unit decimal (as mobile-money operators report amounts) into minor units.
     * Rejects values with more fraction digits than the currency has.
     */
    public static Money ofMajor(BigDecimal majorAmount, CurrencyCode currency) {
        if (majorAmount == null) {
            throw new ValidationException("Amount is required", "amount", null);
        }
        try {
            BigDecimal minor = majorAmount.movePointRight(currency.getMinorDigits());
            return new Money(minor.setScale(0, RoundingMode.UNNECESSARY).longValueExact(), currency);
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount " + majorAmount.toPlainString()
                    + " is not representable in " + currency, e);
        }
    }

    public long getAmountMinorUnits() {
        return amountMinorUnits;
    }

    public CurrencyCode getCurrency() {
        return currency;
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        try {
            return new Money(Math.addExact(amountMinorUnits, other.amountMinorUnits), currency);
        } catch (ArithmeticException e) {
            throw new ValidationException("Money overflow adding " + this + " and " + other, e);
        }
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        try {
            return new Money(Math.subtractExact(amountMinorUnits, other.amountMinorUnits), currency);
        } catch (ArithmeticException e) {
            throw new ValidationException("Money overflow subtracting " + other + " from " + this, e);
        }
    }

    public Money times(long factor) {
        try {
            return new Money(Math.multiplyExact(amountMinorUnits, factor), currency);
        } catch (ArithmeticException e) {
            throw new ValidationException("Money overflow multiplying " + this + " by " + factor, e);
        }
    }

    public Money negate() {
        return times(-1L);
    }

    /**
     * Multiplies by a decimal rate and rounds to the currency's minor unit.
     */
    public Money multiply(BigDecimal rate, RoundingMode roundingMode) {
        BigDecimal product = BigDecimal.valueOf(amountMinorUnits).multiply(rate);
        try {
            return new Money(product.setScale(0, roundingMode).longValueExact(), currency);
        } catch (ArithmeticException e) {
            throw new ValidationException("Money overflow multiplying " + this + " by " + rate, e);
        }
    }

    /**
     * Exact product with a rate, kept unrounded so several partial products can be summed
     * before a single rounding step.
     */
    public BigDecimal multiplyExact(BigDecimal rate) {
        return BigDecimal.valueOf(amountMinorUnits).multiply(rate);
    }

    public BigDecimal toMajor() {
        return BigDecimal.valueOf(amountMinorUnits, currency.getMinorDigits());
    }

    public boolean isNegative() {
        return amountMinorUnits < 0;
    }

    public boolean isZero() {
        return amountMinorUnits == 0;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return compareTo(other) >= 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public void requireSameCurrency(Money other) {
        if (other.currency != currency) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(amountMinorUnits, other.amountMinorUnits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        Money money = (Money) o;
        return amountMinorUnits == money.amountMinorUnits && currency == money.currency;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amountMinorUnits, currency);
    }

    @Override
    public String toString() {
        return toMajor().toPlainString() + " " + currency.getCode();
    }
}
