package io.coko.billing.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.coko.billing.api.dto.SetConfigRequest;
import io.coko.billing.configstore.BillingConfigurationService;
import io.coko.billing.configstore.ConfigEntry;
import io.coko.billing.configstore.ConfigType;
import io.coko.billing.configstore.ConfigValue;
import io.coko.billing.exception.ConfigMissingException;
import io.coko.billing.exception.NotFoundException;
import io.coko.billing.exception.ValidationException;
import io.coko.billing.money.CurrencyCode;
import io.coko.billing.money.Money;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only configuration versions. Existing versions are never changed through this API.
 */
@RestController
@RequestMapping("/api/config")
public class ConfigurationController {

    private final BillingConfigurationService configService;
    private final Clock clock;

    public ConfigurationController(BillingConfigurationService configService, Clock clock) {
        this.configService = configService;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> addVersion(@RequestBody SetConfigRequest request) {
        ConfigType type = type(request.getType());
        if (request.getValue() == null || request.getValue().isNull()) {
            throw new ValidationException("value is required", "value", null);
        }
        Instant effectiveFrom = request.getEffectiveFrom() != null ? request.getEffectiveFrom() : clock.instant();
        ConfigEntry entry = configService.setConfig(type, ApiRequests.required(request.getKey(), "key"),
            toValue(type, request.getValue()), effectiveFrom, request.getActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiViews.configEntry(entry));
    }

    // GET /api/config/ROYALTY_RATE/DIRECT_SALE?asOf=2026-03-01T00:00:00Z
    @GetMapping("/{type}/{key}")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable("type") String typeCode,
            @PathVariable String key,
            @RequestParam(name = "asOf", required = false) String asOfStr) {
        ConfigType type = type(typeCode);
        Instant asOf = asOfStr != null ? ApiRequests.instant(asOfStr, "asOf") : clock.instant();
        ConfigValue value;
        try {
            value = configService.resolve(type, key, asOf);
        } catch (ConfigMissingException e) {
            throw new NotFoundException(type.getCode(), key + "@" + asOf);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("type", type.getCode());
        response.put("key", key);
        response.put("asOf", asOf);
        response.put("value", ApiViews.configValue(value));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{type}/{key}/history")
    public ResponseEntity<List<Map<String, Object>>> history(@PathVariable("type") String typeCode,
            @PathVariable String key) {
        List<Map<String, Object>> versions = new ArrayList<>();
        configService.history(type(typeCode), key).forEach(e -> versions.add(ApiViews.configEntry(e)));
        return ResponseEntity.ok(versions);
    }

    private static ConfigType type(String code) {
        ConfigType type = ConfigType.fromCode(code);
        if (type == null) {
            throw new ValidationException("Unknown config type: " + code, "type", code);
        }
        return type;
    }

    static ConfigValue toValue(ConfigType type, JsonNode node) {
        switch (type.getValueKind()) {
            case DECIMAL:
                try {
                    return ConfigValue.decimal(new BigDecimal(node.asText()));
                } catch (NumberFormatException e) {
                    throw new ValidationException("Expected a decimal value for " + type, "value", node.toString());
                }
            case MONEY:
                JsonNode amount = node.get("amountMinorUnits");
                if (amount == null || !amount.canConvertToLong()) {
                    throw new ValidationException("Expected {amountMinorUnits, currency} for " + type, "value", node.toString());
                }
                CurrencyCode currency = ApiRequests.currency(node.path("currency").asText(null));
                return ConfigValue.money(Money.ofMinor(amount.asLong(), currency));
            case INTEGER:
                if (!node.canConvertToInt()) {
                    throw new ValidationException("Expected an integer value for " + type, "value", node.toString());
                }
                return ConfigValue.integer(node.asInt());
            case DAY_LIST:
                if (!node.isArray()) {
                    throw new ValidationException("Expected an array of day offsets for " + type, "value", node.toString());
                }
                List<Integer> days = new ArrayList<>();
                node.forEach(d -> days.add(d.asInt()));
                return ConfigValue.days(days);
            case CURRENCY_LIST:
                if (!node.isArray()) {
                    throw new ValidationException("Expected an array of currency codes for " + type, "value", node.toString());
                }
                List<CurrencyCode> currencies = new ArrayList<>();
                node.forEach(c -> currencies.add(ApiRequests.currency(c.asText())));
                return ConfigValue.currencies(currencies);
            default:
                throw new IllegalStateException("Unhandled value kind " + type.getValueKind());
        }
    }
}
