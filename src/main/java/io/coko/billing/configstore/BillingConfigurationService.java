package io.coko.billing.configstore;

import io.coko.billing.audit.AuditService;
import io.coko.billing.exception.ConfigMissingException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed, versioned configuration store.
 *
 * Writes are append-only: a new version never replaces an older one, it only takes effect
 * from its own {@code effectiveFrom}. Every read resolves the version effective at a given
 * instant (normally the date of the transaction being priced), so recomputing a past period
 * always sees the rules that applied back then. A missing entry is an error, never a default.
 */
@Service
public class BillingConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(BillingConfigurationService.class);

    private final BillingConfigurationRepository repository;
    private final AuditService auditService;
    private final Clock clock;

    public BillingConfigurationService(BillingConfigurationRepository repository, AuditService auditService, Clock clock) {
        this.repository = repository;
        this.auditService = auditService;
        this.clock = clock;
    }

    public ConfigEntry setConfig(ConfigType type, String key, ConfigValue value, Instant effectiveFrom, String actor) {
        validate(type, key, value, effectiveFrom);
        ConfigEntry entry = new ConfigEntry(UUID.randomUUID(), type, key.trim(), value, effectiveFrom,
            clock.instant(), actor != null ? actor : "system");
        try {
            repository.insert(entry);
        } catch (DuplicateKeyException e) {
            throw new ValidationException("A " + type + " version for key '" + key + "' already takes effect at "
                + effectiveFrom + "; configuration is append-only", "effectiveFrom", effectiveFrom);
        }
        log.info("Configuration version added: type={} key={} value={} effectiveFrom={} actor={}",
            type, entry.getKey(), value, effectiveFrom, entry.getCreatedBy());

        Map<String, Object> details = new HashMap<>();
        details.put("configType", type.getCode());
        details.put("key", entry.getKey());
        details.put("value", value.toString());
        details.put("effectiveFrom", effectiveFrom.toString());
        auditService.logConfigChange(entry.getId(), details, entry.getCreatedBy());
        return entry;
    }

    public ConfigValue resolve(ConfigType type, String key, Instant asOf) {
        ConfigTimeline timeline = new ConfigTimeline(repository.findVersions(type, key));
        return timeline.asOf(asOf)
            .map(ConfigEntry::getValue)
            .orElseThrow(() -> new ConfigMissingException(type, key, asOf));
    }

    /**
     * Resolve {@code key}, falling back to the {@link ConfigType#DEFAULT_KEY} entry when the key has no
     * version in effect.
     */
    public ConfigValue resolveOrDefault(ConfigType type, String key, Instant asOf) {
        ConfigTimeline timeline = new ConfigTimeline(repository.findVersions(type, key));
        Optional<ConfigEntry> entry = timeline.asOf(asOf);
        if (entry.isPresent() || ConfigType.DEFAULT_KEY.equals(key)) {
            return entry.map(ConfigEntry::getValue).orElseThrow(() -> new ConfigMissingException(type, key, asOf));
        }
        return resolve(type, ConfigType.DEFAULT_KEY, asOf);
    }

    public BigDecimal resolveRate(ConfigType type, String key, Instant asOf) {
        return expect(resolve(type, key, asOf), ConfigValue.DecimalValue.class, type).getValue();
    }

    public BigDecimal resolveRateOrDefault(ConfigType type, String key, Instant asOf) {
        return expect(resolveOrDefault(type, key, asOf), ConfigValue.DecimalValue.class, type).getValue();
    }

    public Money resolveThreshold(ConfigType type, String key, Instant asOf) {
        return expect(resolve(type, key, asOf), ConfigValue.MoneyValue.class, type).getValue();
    }

    public int resolveInteger(ConfigType type, String key, Instant asOf) {
        return expect(resolve(type, key, asOf), ConfigValue.IntegerValue.class, type).getValue();
    }

    public int resolveIntegerOrDefault(ConfigType type, String key, Instant asOf) {
        return expect(resolveOrDefault(type, key, asOf), ConfigValue.IntegerValue.class, type).getValue();
    }

    public List<Integer> resolveDays(ConfigType type, String key, Instant asOf) {
        return expect(resolve(type, key, asOf), ConfigValue.DayListValue.class, type).getDays();
    }

    public List<CurrencyCode> resolveCurrencies(ConfigType type, String key, Instant asOf) {
        return expect(resolve(type, key, asOf), ConfigValue.CurrencyListValue.class, type).getCurrencies();
    }

    public void requireSupportedCurrency(CurrencyCode currency, Instant asOf) {
        List<CurrencyCode> supported = resolveCurrencies(ConfigType.SUPPORTED_CURRENCIES, ConfigType.DEFAULT_KEY, asOf);
        if (!supported.contains(currency)) {
            throw new ValidationException("Currency " + currency + " is not supported", "currency", currency);
        }
    }

    public List<ConfigEntry> history(ConfigType type, String key) {
        return repository.findVersions(type, key);
    }

    public List<ConfigEntry> listAll() {
        return repository.findAll();
    }

    private static <T extends ConfigValue> T expect(ConfigValue value, Class<T> expected, ConfigType type) {
        if (!expected.isInstance(value)) {
            throw new IllegalStateException("Config " + type + " holds " + value.kind() + ", expected " + expected.getSimpleName());
        }
        return expected.cast(value);
    }

    private void validate(ConfigType type, String key, ConfigValue value, Instant effectiveFrom) {
        if (type == null) {
            throw new ValidationException("configType is required", "configType", null);
        }
        if (key == null || key.isBlank()) {
            throw new ValidationException("key is required", "key", key);
        }
        if (value == null) {
            throw new ValidationException("value is required", "value", null);
        }
        if (effectiveFrom == null) {
            throw new ValidationException("effectiveFrom is required", "effectiveFrom", null);
        }
        if (value.kind() != type.getValueKind()) {
            throw new ValidationException(type + " expects a " + type.getValueKind() + " value, got " + value.kind(),
                "value", value);
        }
        switch (type) {
            case ROYALTY_RATE:
            case TAX_RATE:
                BigDecimal rate = ((ConfigValue.DecimalValue) value).getValue();
                if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
                    throw new ValidationException(type + " must be between 0 and 1", "value", rate);
                }
                break;
            case PAYOUT_THRESHOLD:
                Money threshold = ((ConfigValue.MoneyValue) value).getValue();
                if (threshold.isNegative()) {
                    throw new ValidationException("Payout threshold cannot be negative", "value", threshold);
                }
                if (!threshold.getCurrency().getCode().equalsIgnoreCase(key.trim())) {
                    throw new ValidationException("Payout threshold key must be its currency code", "key", key);
                }
                break;
            case MAX_RETRY_COUNT:
            case PAYMENT_TERMS_DAYS:
                if (((ConfigValue.IntegerValue) value).getValue() < 0) {
                    throw new ValidationException(type + " cannot be negative", "value", value);
                }
                break;
            case DUNNING_SCHEDULE:
                List<Integer> days = ((ConfigValue.DayListValue) value).getDays();
                if (days.isEmpty()) {
                    throw new ValidationException("Dunning schedule needs at least one offset", "value", days);
                }
                int previous = 0;
                for (Integer day : days) {
                    if (day <= 0 || day < previous) {
                        throw new ValidationException("Dunning offsets must be positive and non-decreasing", "value", days);
                    }
                    previous = day;
                }
                break;
            case SUPPORTED_CURRENCIES:
                List<CurrencyCode> currencies = ((ConfigValue.CurrencyListValue) value).getCurrencies();
                if (currencies.isEmpty() || new HashSet<>(currencies).size() != currencies.size()) {
                    throw new ValidationException("Supported currencies must be a non-empty list of distinct codes",
                        "value", currencies);
                }
                break;
            default:
                break;
        }
    }
}
