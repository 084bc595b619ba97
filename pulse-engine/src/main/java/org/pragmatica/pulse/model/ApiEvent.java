package org.pragmatica.pulse.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single admitted measurement. The timestamp is the server receipt time used for windowing.
 */
public record ApiEvent(String key, MetricName metric, Instant timestamp, double value) {
    public ApiEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ApiEvent apiEvent(String key, MetricName metric, Instant timestamp, double value) {
        return new ApiEvent(key, metric, timestamp, value);
    }

    public SeriesKey seriesKey() {
        return SeriesKey.seriesKey(key, metric);
    }

    public ApiEvent withTimestamp(Instant timestamp) {
        return new ApiEvent(key, metric, timestamp, value);
    }
}
