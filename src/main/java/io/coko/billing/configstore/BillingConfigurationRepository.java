package io.coko.billing.configstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only storage for {@link ConfigEntry} versions. Values are stored as JSON,
 * shaped by the value kind of their {@link ConfigType}.
 */
@Repository
public class BillingConfigurationRepository {

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public BillingConfigurationRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws DuplicateKeyException if a version with the same effective instant already exists
     */
    public void insert(ConfigEntry entry) {
        jdbc.update("""
            INSERT INTO billing_configuration
            (id, config_type, config_key, value_json, effective_from, created_at, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            entry.getId(),
            entry.getConfigType().getCode(),
            entry.getKey(),
            encode(entry.getValue()),
            Timestamp.from(entry.getEffectiveFrom()),
            Timestamp.from(entry.getCreatedAt()),
            entry.getCreatedBy()
        );
    }

    public List<ConfigEntry> findVersions(ConfigType type, String key) {
        return jdbc.query("""
            SELECT id, config_type, config_key, value_json, effective_from, created_at, created_by
            FROM billing_configuration
            WHERE config_type = ? AND config_key = ?
            ORDER BY effective_from
            """,
            rowMapper(),
            type.getCode(), key
        );
    }

    public List<ConfigEntry> findAll() {
        return jdbc.query("""
            SELECT id, config_type, config_key, value_json, effective_from, created_at, created_by
            FROM billing_configuration
            ORDER BY config_type, config_key, effective_from
            """,
            rowMapper()
        );
    }

    private RowMapper<ConfigEntry> rowMapper() {
        return (rs, rowNum) -> {
            ConfigType type = ConfigType.fromCode(rs.getString("config_type"));
            return new ConfigEntry(
                rs.getObject("id", UUID.class),
                type,
                rs.getString("config_key"),
                decode(type, rs.getString("value_json")),
                rs.getTimestamp("effective_from").toInstant(),
                rs.getTimestamp("created_at").toInstant(),
                rs.getString("created_by")
            );
        };
    }

    String encode(ConfigValue value) {
        ObjectNode node = objectMapper.createObjectNode();
        if (value instanceof ConfigValue.DecimalValue) {
            node.put("value", ((ConfigValue.DecimalValue) value).getValue().toPlainString());
        } else if (value instanceof ConfigValue.MoneyValue) {
            Money money = ((ConfigValue.MoneyValue) value).getValue();
            node.put("amountMinorUnits", money.getAmountMinorUnits());
            node.put("currency", money.getCurrency().getCode());
        } else if (value instanceof ConfigValue.IntegerValue) {
            node.put("value", ((ConfigValue.IntegerValue) value).getValue());
        } else if (value instanceof ConfigValue.DayListValue) {
            ArrayNode days = node.putArray("days");
            ((ConfigValue.DayListValue) value).getDays().forEach(days::add);
        } else if (value instanceof ConfigValue.CurrencyListValue) {
            ArrayNode currencies = node.putArray("currencies");
            ((ConfigValue.CurrencyListValue) value).getCurrencies().forEach(c -> currencies.add(c.getCode()));
        } else {
            throw new IllegalArgumentException("Unsupported config value: " + value);
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config value", e);
        }
    }

    ConfigValue decode(ConfigType type, String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt config value for " + type + ": " + json, e);
        }
        switch (type.getValueKind()) {
            case DECIMAL:
                return ConfigValue.decimal(new BigDecimal(node.get("value").asText()));
            case MONEY:
                CurrencyCode currency = CurrencyCode.fromCode(node.get("currency").asText());
                if (currency == null) {
                    throw new ValidationException("Unsupported currency in config " + type, "currency", node.get("currency"));
                }
                return ConfigValue.money(Money.ofMinor(node.get("amountMinorUnits").asLong(), currency));
            case INTEGER:
                return ConfigValue.integer(node.get("value").asInt());
            case DAY_LIST:
                List<Integer> days = new ArrayList<>();
                node.get("days").forEach(d -> days.add(d.asInt()));
                return ConfigValue.days(days);
            case CURRENCY_LIST:
                List<CurrencyCode> currencies = new ArrayList<>();
                node.get("currencies").forEach(c -> currencies.add(CurrencyCode.fromCode(c.asText())));
                return ConfigValue.currencies(currencies);
            default:
                throw new IllegalStateException("Unhandled value kind " + type.getValueKind());
        }
    }
}
