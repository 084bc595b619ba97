package org.pragmatica.pulse.engine;

import org.pragmatica.pulse.model.SeriesKey;
import org.pragmatica.pulse.model.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Service-wide figures over the current windows, for dashboards.
 * <p>
 * Requests are counted from latency events, so a whole-call record counts as one request.
 *
 * @param windowStart       Oldest admissible receipt time
 * @param windowEnd         Time the summary was computed
 * @param requests          Requests in the window
 * @param requestsPerMinute Requests normalized to one minute
 * @param avgLatency        Mean latency in milliseconds
 * @param p50Latency        Median latency in milliseconds
 * @param p95Latency        95th percentile latency in milliseconds
 * @param p99Latency        99th percentile latency in milliseconds
 * @param errorRate         Fraction of error events equal to 1, 0 when there are none
 * @param tokensPerMinute   Volume normalized to one minute
 * @param estimatedCostUsd  Token cost of the window at {@link #TOKEN_COST_PER_1K} USD per 1000 tokens
 * @param perKeyRequests    Requests per key, ordered by key
 * @param activeAnomalies   Series currently not HEALTHY
 */
public record ServiceSummary(Instant windowStart,
                             Instant windowEnd,
                             long requests,
                             double requestsPerMinute,
                             double avgLatency,
                             double p50Latency,
                             double p95Latency,
                             double p99Latency,
                             double errorRate,
                             double tokensPerMinute,
                             double estimatedCostUsd,
                             Map<String, Long> perKeyRequests,
                             Map<SeriesKey, Severity> activeAnomalies) {
    public static final double TOKEN_COST_PER_1K = 0.002;

    public ServiceSummary {
        perKeyRequests = Collections.unmodifiableSortedMap(new TreeMap<>(perKeyRequests));
        activeAnomalies = Collections.unmodifiableMap(new LinkedHashMap<>(activeAnomalies));
    }
}
