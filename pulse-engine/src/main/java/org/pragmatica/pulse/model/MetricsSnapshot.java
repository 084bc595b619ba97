package org.pragmatica.pulse.model;

import java.time.Instant;

/**
 * Statistics of one series over its current window. Derived data, recomputable at any time from the window.
 *
 * @param key         Series key
 * @param metric      Series metric
 * @param count       Number of events in the window
 * @param mean        Mean value, 0 for an empty window
 * @param variance    Population variance, never negative
 * @param stddev      Square root of the variance
 * @param p50         Median value
 * @param p95         95th percentile value
 * @param p99         99th percentile value
 * @param windowStart Oldest admissible timestamp (now - W)
 * @param windowEnd   Evaluation time (now)
 */
public record MetricsSnapshot(String key,
                              MetricName metric,
                              long count,
                              double mean,
                              double variance,
                              double stddev,
                              double p50,
                              double p95,
                              double p99,
                              Instant windowStart,
                              Instant windowEnd) {
    public static MetricsSnapshot empty(SeriesKey series, Instant windowStart, Instant windowEnd) {
        return new MetricsSnapshot(series.key(), series.metric(), 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, windowStart, windowEnd);
    }

    public SeriesKey seriesKey() {
        return SeriesKey.seriesKey(key, metric);
    }

    /**
     * Value above which an observation is considered anomalous for the given sensitivity.
     */
    public double threshold(double k) {
        return mean + k * stddev;
    }
}
