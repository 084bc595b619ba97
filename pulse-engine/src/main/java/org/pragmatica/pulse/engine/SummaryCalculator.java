package org.pragmatica.pulse.engine;

import org.pragmatica.pulse.aggregate.Percentiles;
import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.SeriesKey;
import org.pragmatica.pulse.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds per-series window copies into a {@link ServiceSummary}.
 */
final class SummaryCalculator {
    private final double windowMinutes;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final Map<String, Long> perKeyRequests = new TreeMap<>();

    private double[] latencies = new double[64];
    private int latencyCount = 0;
    private double latencySum = 0;
    private long errorEvents = 0;
    private double errors = 0;
    private double tokens = 0;

    SummaryCalculator(Duration window, Instant now) {
        this.windowMinutes = window.toMillis() / 60_000.0;
        this.windowStart = now.minus(window);
        this.windowEnd = now;
    }

    void add(SeriesKey series, List<ApiEvent> events) {
        switch (series.metric()) {
            case LATENCY -> {
                perKeyRequests.merge(series.key(), (long) events.size(), Long::sum);
                for (var event : events) {
                    addLatency(event.value());
                }
            }
            case ERROR -> {
                errorEvents += events.size();
                for (var event : events) {
                    errors += event.value();
                }
            }
            case VOLUME -> {
                for (var event : events) {
                    tokens += event.value();
                }
            }
        }
    }

    ServiceSummary summary(Map<SeriesKey, Severity> activeAnomalies) {
        var sorted = Arrays.copyOf(latencies, latencyCount);
        Arrays.sort(sorted);
        return new ServiceSummary(windowStart,
                                  windowEnd,
                                  latencyCount,
                                  latencyCount / windowMinutes,
                                  latencyCount == 0
                                  ? 0.0
                                  : latencySum / latencyCount,
                                  Percentiles.percentile(sorted, 50),
                                  Percentiles.percentile(sorted, 95),
                                  Percentiles.percentile(sorted, 99),
                                  errorEvents == 0
                                  ? 0.0
                                  : errors / errorEvents,
                                  tokens / windowMinutes,
                                  tokens / 1000 * ServiceSummary.TOKEN_COST_PER_1K,
                                  perKeyRequests,
                                  activeAnomalies);
    }

    private void addLatency(double value) {
        if (latencyCount == latencies.length) {
            latencies = Arrays.copyOf(latencies, latencies.length * 2);
        }
        latencies[latencyCount++] = value;
        latencySum += value;
    }
}
