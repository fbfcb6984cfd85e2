package io.coko.billing.configstore;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * All versions of one configuration key ordered by effective instant.
 * Lookups take the latest version effective at or before the query instant.
 */
public class ConfigTimeline {

    private final TreeMap<Instant, ConfigEntry> versions = new TreeMap<>();

    public ConfigTimeline(List<ConfigEntry> entries) {
        for (ConfigEntry entry : entries) {
            versions.put(entry.getEffectiveFrom(), entry);
        }
    }

    public Optional<ConfigEntry> asOf(Instant instant) {
        Map.Entry<Instant, ConfigEntry> floor = versions.floorEntry(instant);
        return floor == null ? Optional.empty() : Optional.of(floor.getValue());
    }

    public boolean isEmpty() {
        return versions.isEmpty();
    }

    public int size() {
        return versions.size();
    }
}
