package io.coko.billing.money;

import io.coko.billing.exception.CurrencyMismatchException;
import io.coko.billing.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyTest {

	// ============ Arithmetic ============

	@Test
	void add_sameCurrency_sumsMinorUnits() {
		Money total = Money.ofMinor(1050, CurrencyCode.EUR).add(Money.ofMinor(250, CurrencyCode.EUR));

		assertThat(total).isEqualTo(Money.ofMinor(1300, CurrencyCode.EUR));
	}

	@Test
	void add_differentCurrency_throwsMismatch() {
		assertThatThrownBy(() -> Money.ofMinor(100, CurrencyCode.EUR).add(Money.ofMinor(100, CurrencyCode.XOF)))
			.isInstanceOf(CurrencyMismatchException.class);
	}

	@Test
	void compare_differentCurrency_throwsMismatch() {
		assertThatThrownBy(() -> Money.ofMinor(100, CurrencyCode.USD).isLessThan(Money.ofMinor(100, CurrencyCode.EUR)))
			.isInstanceOf(CurrencyMismatchException.class);
	}

	@Test
	void add_overflow_isRejected() {
		Money max = Money.ofMinor(Long.MAX_VALUE, CurrencyCode.EUR);

		assertThatThrownBy(() -> max.add(Money.ofMinor(1, CurrencyCode.EUR)))
			.isInstanceOf(ValidationException.class)
			.hasMessageContaining("overflow");
	}

	@Test
	void times_overflow_isRejected() {
		assertThatThrownBy(() -> Money.ofMinor(Long.MAX_VALUE / 2 + 1, CurrencyCode.EUR).times(2))
			.isInstanceOf(ValidationException.class);
	}

	@Test
	void multiply_roundsHalfEvenToMinorUnit() {
		Money amount = Money.ofMinor(125, CurrencyCode.EUR);

		assertThat(amount.multiply(new BigDecimal("0.5"), RoundingMode.HALF_EVEN).getAmountMinorUnits()).isEqualTo(62);
		assertThat(amount.multiply(new BigDecimal("0.5"), RoundingMode.HALF_UP).getAmountMinorUnits()).isEqualTo(63);
	}

	@Test
	void multiply_overflow_isRejected() {
		Money max = Money.ofMinor(Long.MAX_VALUE, CurrencyCode.EUR);

		assertThatThrownBy(() -> max.multiply(new BigDecimal("1.5"), RoundingMode.HALF_EVEN))
			.isInstanceOf(ValidationException.class)
			.hasMessageContaining("overflow");
	}

	// ============ Major units ============

	@Test
	void ofMajor_twoDecimalCurrency_convertsToCents() {
		assertThat(Money.ofMajor(new BigDecimal("12.34"), CurrencyCode.EUR).getAmountMinorUnits()).isEqualTo(1234);
	}

	@Test
	void ofMajor_zeroDecimalCurrency_keepsWholeUnits() {
		assertThat(Money.ofMajor(new BigDecimal("5000"), CurrencyCode.XOF).getAmountMinorUnits()).isEqualTo(5000);
	}

	@Test
	void ofMajor_tooManyFractionDigits_isRejected() {
		assertThatThrownBy(() -> Money.ofMajor(new BigDecimal("10.5"), CurrencyCode.XAF))
			.isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> Money.ofMajor(new BigDecimal("1.005"), CurrencyCode.EUR))
			.isInstanceOf(ValidationException.class);
	}

	@Test
	void toMajor_usesCurrencyScale() {
		assertThat(Money.ofMinor(1999, CurrencyCode.USD).toMajor()).isEqualByComparingTo("19.99");
		assertThat(Money.ofMinor(1999, CurrencyCode.XOF).toMajor()).isEqualByComparingTo("1999");
	}
}
