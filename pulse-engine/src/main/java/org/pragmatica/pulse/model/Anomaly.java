package org.pragmatica.pulse.model;

import java.time.Instant;

/**
 * Result of one detector evaluation.
 *
 * @param key                Series key
 * @param metric             Series metric
 * @param observedValue      Value of the event that triggered the evaluation
 * @param threshold          Boundary the value was compared against
 * @param severity           Classified severity
 * @param timestamp          Receipt time of the triggering event
 * @param previousSeverity   Severity reported before this evaluation
 * @param insufficientSample True when the baseline had fewer than the minimum sample count
 */
public record Anomaly(String key,
                      MetricName metric,
                      double observedValue,
                      double threshold,
                      Severity severity,
                      Instant timestamp,
                      Severity previousSeverity,
                      boolean insufficientSample) {
    public SeriesKey seriesKey() {
        return SeriesKey.seriesKey(key, metric);
    }

    public boolean isTransition() {
        return severity != previousSeverity;
    }
}
