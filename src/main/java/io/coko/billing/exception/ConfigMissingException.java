package io.coko.billing.exception;

import io.coko.billing.configstore.ConfigType;

import java.time.Instant;

/**
 * No configuration entry is effective for the requested key at the requested instant.
 */
public class ConfigMissingException extends BillingException {

    private final ConfigType configType;
    private final String key;
    private final Instant asOf;

    public ConfigMissingException(ConfigType configType, String key, Instant asOf) {
        super("configuration_missing",
                "No " + configType + " configured for key '" + key + "' as of " + asOf);
        this.configType = configType;
        this.key = key;
        this.asOf = asOf;
    }

    public ConfigType getConfigType() {
        return configType;
    }

    public String getKey() {
        return key;
    }

    public Instant getAsOf() {
        return asOf;
    }
}
