package org.pragmatica.pulse.detect;

import org.pragmatica.pulse.config.PulseConfig;
import org.pragmatica.pulse.model.Anomaly;
import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.MetricName;
import org.pragmatica.pulse.model.MetricsSnapshot;
import org.pragmatica.pulse.model.SeriesKey;
import org.pragmatica.pulse.model.Severity;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies observations with the k-sigma rule and tracks per-series severity transitions.
 * <p>
 * Rule, evaluated against a baseline that excludes the observation itself:
 * <ul>
 *   <li>baseline count below the minimum sample count: HEALTHY</li>
 *   <li>{@code observed > mean + kCritical * stddev}: CRITICAL</li>
 *   <li>{@code observed > mean + kWarning * stddev}: WARNING</li>
 *   <li>otherwise: HEALTHY</li>
 * </ul>
 * Comparisons are strict, so a value exactly on a boundary is not anomalous.
 * <p>
 * Error series carry a second rule. A 0/1 series drifts its own baseline upwards as failures accumulate, so the
 * k-sigma rule alone misses a sustained error rate. When the window, including the observation, holds at least
 * the minimum sample count and its error rate exceeds {@code maxErrorRate}, the result is at least WARNING with
 * {@code maxErrorRate} as threshold.
 * <p>
 * The only state kept per series is the last reported severity. {@link #evaluate} must be called under the
 * series lock so transitions of one series are observed in admission order.
 */
public final class AnomalyDetector {
    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final double kWarning;
    private final double kCritical;
    private final int minSamples;
    private final double maxErrorRate;
    private final Map<SeriesKey, SeverityTracker> trackers = new ConcurrentHashMap<>();

    private AnomalyDetector(double kWarning, double kCritical, int minSamples, double maxErrorRate) {
        this.kWarning = kWarning;
        this.kCritical = kCritical;
        this.minSamples = minSamples;
        this.maxErrorRate = maxErrorRate;
    }

    public static AnomalyDetector anomalyDetector(PulseConfig config) {
        return new AnomalyDetector(config.kWarning(), config.kCritical(), config.minSamples(), config.maxErrorRate());
    }

    /**
     * Apply the k-sigma rule and, for error series, the error rate rule. Pure; does not touch per-series state.
     */
    public Classification classify(MetricsSnapshot baseline, double observed) {
        var classification = classifySigma(baseline, observed);
        if (baseline.metric() != MetricName.ERROR || !Severity.WARNING.isWorseThan(classification.severity())) {
            return classification;
        }
        var count = baseline.count() + 1;
        var errorRate = (baseline.mean() * baseline.count() + observed) / count;
        if (count >= minSamples && errorRate > maxErrorRate) {
            return new Classification(Severity.WARNING, maxErrorRate, false);
        }
        return classification;
    }

    private Classification classifySigma(MetricsSnapshot baseline, double observed) {
        var warningThreshold = baseline.threshold(kWarning);
        if (baseline.count() < minSamples) {
            return new Classification(Severity.HEALTHY, warningThreshold, true);
        }
        var criticalThreshold = baseline.threshold(kCritical);
        if (observed > criticalThreshold) {
            return new Classification(Severity.CRITICAL, criticalThreshold, false);
        }
        if (observed > warningThreshold) {
            return new Classification(Severity.WARNING, warningThreshold, false);
        }
        return new Classification(Severity.HEALTHY, warningThreshold, false);
    }

    /**
     * Classify the observation and advance the series state machine.
     *
     * @param baseline Statistics of the window excluding {@code observed}
     * @param observed The event that triggered the evaluation
     * @return the evaluation; {@link Anomaly#isTransition()} tells whether severity changed
     */
    public Anomaly evaluate(MetricsSnapshot baseline, ApiEvent observed) {
        var classification = classify(baseline, observed.value());
        var tracker = trackers.computeIfAbsent(observed.seriesKey(), key -> new SeverityTracker());
        var previous = tracker.advance(classification.severity());
        var anomaly = new Anomaly(observed.key(),
                                  observed.metric(),
                                  observed.value(),
                                  classification.threshold(),
                                  classification.severity(),
                                  observed.timestamp(),
                                  previous,
                                  classification.insufficientSample());
        if (anomaly.isTransition()) {
            logTransition(anomaly);
        }
        return anomaly;
    }

    /**
     * Forget an idle series. A series that was not HEALTHY reports its recovery.
     *
     * @param at Time of the recovery
     * @return the recovery transition, empty when the series was HEALTHY or unknown
     */
    public Optional<Anomaly> retire(SeriesKey series, Instant at) {
        var tracker = trackers.remove(series);
        if (tracker == null || tracker.current() == Severity.HEALTHY) {
            return Optional.empty();
        }
        var recovery = new Anomaly(series.key(),
                                   series.metric(),
                                   0.0,
                                   0.0,
                                   Severity.HEALTHY,
                                   at,
                                   tracker.current(),
                                   true);
        log.info("{} transitioned {} -> {}: window empty", series, recovery.previousSeverity(), recovery.severity());
        return Optional.of(recovery);
    }

    /**
     * Last reported severity of a series; HEALTHY for a series never evaluated.
     */
    public Severity severity(SeriesKey series) {
        var tracker = trackers.get(series);
        return tracker == null
               ? Severity.HEALTHY
               : tracker.current();
    }

    /**
     * Series currently in WARNING or CRITICAL, ordered by key.
     */
    public Map<SeriesKey, Severity> activeAnomalies() {
        var result = new TreeMap<SeriesKey, Severity>((a, b) -> a.toString()
                                                                  .compareTo(b.toString()));
        trackers.forEach((key, tracker) -> {
            var current = tracker.current();
            if (current != Severity.HEALTHY) {
                result.put(key, current);
            }
        });
        return result;
    }

    private static void logTransition(Anomaly anomaly) {
        if (anomaly.severity() == Severity.CRITICAL) {
            log.warn("{} transitioned {} -> {}: observed {} > threshold {}",
                     anomaly.seriesKey(),
                     anomaly.previousSeverity(),
                     anomaly.severity(),
                     anomaly.observedValue(),
                     anomaly.threshold());
        } else {
            log.info("{} transitioned {} -> {}: observed {}, threshold {}",
                     anomaly.seriesKey(),
                     anomaly.previousSeverity(),
                     anomaly.severity(),
                     anomaly.observedValue(),
                     anomaly.threshold());
        }
    }
}
