package org.pragmatica.pulse.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Metrics tracked per key.
 */
public enum MetricName {
    /** Request latency in milliseconds. */
    LATENCY("latency"),
    /** Request outcome, 1 for an error and 0 for success. */
    ERROR("error"),
    /** Request volume, e.g. tokens consumed by the call. */
    VOLUME("volume");

    private final String wireName;

    MetricName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a metric by its wire name, case-insensitive.
     */
    public static Optional<MetricName> fromString(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var normalized = name.trim()
                             .toLowerCase(Locale.ROOT);
        for (var metric : values()) {
            if (metric.wireName.equals(normalized)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
