package io.coko.billing.configstore;

import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed configuration value. One subclass per {@link ConfigType.ValueKind}.
 */
public abstract class ConfigValue {

    public abstract ConfigType.ValueKind kind();

    public static DecimalValue decimal(BigDecimal value) {
        return new DecimalValue(value);
    }

    public static MoneyValue money(Money value) {
        return new MoneyValue(value);
    }

    public static IntegerValue integer(int value) {
        return new IntegerValue(value);
    }

    public static DayListValue days(List<Integer> days) {
        return new DayListValue(days);
    }

    public static CurrencyListValue currencies(List<CurrencyCode> currencies) {
        return new CurrencyListValue(currencies);
    }

    public static final class DecimalValue extends ConfigValue {
        private final BigDecimal value;

        DecimalValue(BigDecimal value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public BigDecimal getValue() {
            return value;
        }

        @Override
        public ConfigType.ValueKind kind() {
            return ConfigType.ValueKind.DECIMAL;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DecimalValue && value.compareTo(((DecimalValue) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    public static final class MoneyValue extends ConfigValue {
        private final Money value;

        MoneyValue(Money value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public Money getValue() {
            return value;
        }

        @Override
        public ConfigType.ValueKind kind() {
            return ConfigType.ValueKind.MONEY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MoneyValue && value.equals(((MoneyValue) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class IntegerValue extends ConfigValue {
        private final int value;

        IntegerValue(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }

        @Override
        public ConfigType.ValueKind kind() {
            return ConfigType.ValueKind.INTEGER;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerValue && value == ((IntegerValue) o).value;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class DayListValue extends ConfigValue {
        private final List<Integer> days;

        DayListValue(List<Integer> days) {
            this.days = List.copyOf(Objects.requireNonNull(days, "days"));
        }

        public List<Integer> getDays() {
            return Collections.unmodifiableList(days);
        }

        @Override
        public ConfigType.ValueKind kind() {
            return ConfigType.ValueKind.DAY_LIST;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof DayListValue && days.equals(((DayListValue) o).days);
        }

        @Override
        public int hashCode() {
            return days.hashCode();
        }

        @Override
        public String toString() {
            return days.toString();
        }
    }

    public static final class CurrencyListValue extends ConfigValue {
        private final List<CurrencyCode> currencies;

        CurrencyListValue(List<CurrencyCode> currencies) {
            this.currencies = List.copyOf(Objects.requireNonNull(currencies, "currencies"));
        }

        public List<CurrencyCode> getCurrencies() {
            return currencies;
        }

        @Override
        public ConfigType.ValueKind kind() {
            return ConfigType.ValueKind.CURRENCY_LIST;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof CurrencyListValue && currencies.equals(((CurrencyListValue) o).currencies);
        }

        @Override
        public int hashCode() {
            return currencies.hashCode();
        }

        @Override
        public String toString() {
            return currencies.toString();
        }
    }
}
