package io.coko.billing.support;

import io.coko.billing.configstore.BillingConfigurationService;
import io.coko.billing.configstore.ConfigType;
import io.coko.billing.configstore.ConfigValue;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Base class for tests against the full application context on H2.
 * Every test starts from empty billing tables, the clock at {@link TestClockConfig#START}
 * and a baseline configuration effective since 2020.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class AbstractIntegrationTest {

	protected static final Instant CONFIG_EPOCH = Instant.parse("2020-01-01T00:00:00Z");

	private static final List<String> TABLES = List.of(
		"royalty_source_transaction", "author_royalty", "royalty_period_lock",
		"charge_attempt", "invoice_item", "invoice", "invoice_sequence", "recurring_billing", "payment_transaction",
		"billing_configuration", "billing_task", "billing_dead_letter_queue", "billing_audit_log",
		"billing_run_item", "billing_run");

	@Autowired
	protected JdbcTemplate jdbc;

	@Autowired
	protected MutableClock clock;

	@Autowired
	protected BillingConfigurationService configService;

	@BeforeEach
	void resetState() {
		for (String table : TABLES) {
			jdbc.update("DELETE FROM " + table);
		}
		clock.setInstant(TestClockConfig.START);
		seedConfiguration();
	}

	protected void seedConfiguration() {
		configService.setConfig(ConfigType.SUPPORTED_CURRENCIES, ConfigType.DEFAULT_KEY,
			ConfigValue.currencies(List.of(CurrencyCode.EUR, CurrencyCode.USD, CurrencyCode.XOF, CurrencyCode.XAF)),
			CONFIG_EPOCH, "test");
		configService.setConfig(ConfigType.PAYMENT_TERMS_DAYS, ConfigType.DEFAULT_KEY, ConfigValue.integer(14),
			CONFIG_EPOCH, "test");
		configService.setConfig(ConfigType.MAX_RETRY_COUNT, ConfigType.DEFAULT_KEY, ConfigValue.integer(3),
			CONFIG_EPOCH, "test");
		configService.setConfig(ConfigType.DUNNING_SCHEDULE, ConfigType.DEFAULT_KEY, ConfigValue.days(List.of(1, 3, 7)),
			CONFIG_EPOCH, "test");
		configService.setConfig(ConfigType.ROYALTY_RATE, ConfigType.DEFAULT_KEY,
			ConfigValue.decimal(new BigDecimal("0.70")), CONFIG_EPOCH, "test");
		configService.setConfig(ConfigType.PAYOUT_THRESHOLD, "EUR",
			ConfigValue.money(Money.ofMinor(5000, CurrencyCode.EUR)), CONFIG_EPOCH, "test");
		configService.setConfig(ConfigType.PAYOUT_THRESHOLD, "XOF",
			ConfigValue.money(Money.ofMinor(10000, CurrencyCode.XOF)), CONFIG_EPOCH, "test");
	}
}
