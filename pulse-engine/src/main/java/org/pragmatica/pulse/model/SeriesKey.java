package org.pragmatica.pulse.model;

import java.util.Objects;

/**
 * Identifies one (key, metric) series. Each series owns exactly one window and is the unit of concurrency.
 */
public record SeriesKey(String key, MetricName metric) {
    public SeriesKey {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(metric, "metric");
    }

    public static SeriesKey seriesKey(String key, MetricName metric) {
        return new SeriesKey(key, metric);
    }

    @Override
    public String toString() {
        return key + "/" + metric.wireName();
    }
}
