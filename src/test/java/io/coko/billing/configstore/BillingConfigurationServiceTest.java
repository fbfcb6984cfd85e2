package io.coko.billing.configstore;

import io.coko.billing.exception.ConfigMissingException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import io.coko.billing.support.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingConfigurationServiceTest extends AbstractIntegrationTest {

	private static final Instant JAN = Instant.parse("2025-01-01T00:00:00Z");
	private static final Instant MAR = Instant.parse("2025-03-01T00:00:00Z");

	// ============ As-of resolution ============

	@Test
	void resolve_returnsVersionInEffectAtInstant() {
		configService.setConfig(ConfigType.ROYALTY_RATE, "TIP", ConfigValue.decimal(new BigDecimal("0.90")), JAN, "ops");
		configService.setConfig(ConfigType.ROYALTY_RATE, "TIP", ConfigValue.decimal(new BigDecimal("0.85")), MAR, "ops");

		assertThat(configService.resolveRate(ConfigType.ROYALTY_RATE, "TIP", MAR.minusSeconds(1)))
			.isEqualByComparingTo("0.90");
		assertThat(configService.resolveRate(ConfigType.ROYALTY_RATE, "TIP", MAR)).isEqualByComparingTo("0.85");
		assertThat(configService.resolveRate(ConfigType.ROYALTY_RATE, "TIP", MAR.plusSeconds(86400)))
			.isEqualByComparingTo("0.85");
	}

	@Test
	void resolve_beforeFirstVersion_isMissing() {
		configService.setConfig(ConfigType.ROYALTY_RATE, "TIP", ConfigValue.decimal(new BigDecimal("0.90")), MAR, "ops");

		assertThatThrownBy(() -> configService.resolveRate(ConfigType.ROYALTY_RATE, "TIP", JAN))
			.isInstanceOf(ConfigMissingException.class);
	}

	@Test
	void resolveOrDefault_fallsBackToDefaultKey() {
		assertThat(configService.resolveRateOrDefault(ConfigType.ROYALTY_RATE, "SUBSCRIPTION_READ", JAN))
			.isEqualByComparingTo("0.70");
	}

	@Test
	void resolve_unknownKeyWithoutFallback_isMissing() {
		assertThatThrownBy(() -> configService.resolveThreshold(ConfigType.PAYOUT_THRESHOLD, "XAF", JAN))
			.isInstanceOf(ConfigMissingException.class);
	}

	// ============ Append-only writes ============

	@Test
	void setConfig_sameEffectiveInstantTwice_isRejected() {
		configService.setConfig(ConfigType.MAX_RETRY_COUNT, "premium", ConfigValue.integer(5), MAR, "ops");

		assertThatThrownBy(() -> configService.setConfig(ConfigType.MAX_RETRY_COUNT, "premium",
			ConfigValue.integer(6), MAR, "ops"))
			.isInstanceOf(ValidationException.class)
			.hasMessageContaining("append-only");
		assertThat(configService.history(ConfigType.MAX_RETRY_COUNT, "premium")).hasSize(1);
	}

	@Test
	void setConfig_laterVersion_keepsHistory() {
		configService.setConfig(ConfigType.PAYMENT_TERMS_DAYS, "coko-sn", ConfigValue.integer(30), JAN, "ops");
		configService.setConfig(ConfigType.PAYMENT_TERMS_DAYS, "coko-sn", ConfigValue.integer(15), MAR, "ops");

		List<ConfigEntry> history = configService.history(ConfigType.PAYMENT_TERMS_DAYS, "coko-sn");

		assertThat(history).extracting(ConfigEntry::getEffectiveFrom).containsExactly(JAN, MAR);
		assertThat(history).extracting(ConfigEntry::getCreatedBy).containsOnly("ops");
	}

	// ============ Validation ============

	@Test
	void setConfig_wrongValueKind_isRejected() {
		assertThatThrownBy(() -> configService.setConfig(ConfigType.ROYALTY_RATE, "TIP", ConfigValue.integer(1), MAR, "ops"))
			.isInstanceOf(ValidationException.class);
	}

	@Test
	void setConfig_rateOutOfRange_isRejected() {
		assertThatThrownBy(() -> configService.setConfig(ConfigType.ROYALTY_RATE, "TIP",
			ConfigValue.decimal(new BigDecimal("1.2")), MAR, "ops"))
			.isInstanceOf(ValidationException.class);
	}

	@Test
	void setConfig_thresholdKeyMustMatchCurrency() {
		assertThatThrownBy(() -> configService.setConfig(ConfigType.PAYOUT_THRESHOLD, "EUR",
			ConfigValue.money(Money.ofMinor(100, CurrencyCode.USD)), MAR, "ops"))
			.isInstanceOf(ValidationException.class);
	}

	@Test
	void setConfig_decreasingDunningSchedule_isRejected() {
		assertThatThrownBy(() -> configService.setConfig(ConfigType.DUNNING_SCHEDULE, ConfigType.DEFAULT_KEY,
			ConfigValue.days(List.of(3, 1)), MAR, "ops"))
			.isInstanceOf(ValidationException.class);
	}

	@Test
	void requireSupportedCurrency_followsConfiguredList() {
		configService.setConfig(ConfigType.SUPPORTED_CURRENCIES, ConfigType.DEFAULT_KEY,
			ConfigValue.currencies(List.of(CurrencyCode.XOF)), MAR, "ops");

		configService.requireSupportedCurrency(CurrencyCode.EUR, JAN);
		assertThatThrownBy(() -> configService.requireSupportedCurrency(CurrencyCode.EUR, MAR))
			.isInstanceOf(ValidationException.class);
	}
}
