package io.coko.billing.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * New configuration version. The shape of {@code value} depends on the config type:
 * a decimal string for rates, {"amountMinorUnits", "currency"} for thresholds, an integer,
 * an array of day offsets, or an array of currency codes.
 */
public class SetConfigRequest {

    private String type;
    private String key;
    private JsonNode value;
    private Instant effectiveFrom;
    private String actor;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public JsonNode getValue() {
        return value;
    }

    public void setValue(JsonNode value) {
        this.value = value;
    }

    public Instant getEffectiveFrom() {
        return effectiveFrom;
    }

    public void setEffectiveFrom(Instant effectiveFrom) {
        this.effectiveFrom = effectiveFrom;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }
}
