package io.coko.billing.configstore;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable version of a configuration key.
 */
public class ConfigEntry {

    private final UUID id;
    private final ConfigType configType;
    private final String key;
    private final ConfigValue value;
    private final Instant effectiveFrom;
    private final Instant createdAt;
    private final String createdBy;

    public ConfigEntry(UUID id, ConfigType configType, String key, ConfigValue value,
                       Instant effectiveFrom, Instant createdAt, String createdBy) {
        this.id = id;
        this.configType = configType;
        this.key = key;
        this.value = value;
        this.effectiveFrom = effectiveFrom;
        this.createdAt = createdAt;
        this.createdBy = createdBy;
    }

    public UUID getId() {
        return id;
    }

    public ConfigType getConfigType() {
        return configType;
    }

    public String getKey() {
        return key;
    }

    public ConfigValue getValue() {
        return value;
    }

    public Instant getEffectiveFrom() {
        return effectiveFrom;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }
}
