package org.pragmatica.pulse.ingest;

import org.pragmatica.pulse.aggregate.MetricsAggregator;
import org.pragmatica.pulse.alert.AlertDispatcher;
import org.pragmatica.pulse.detect.AnomalyDetector;
import org.pragmatica.pulse.model.Anomaly;
import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.MetricName;
import org.pragmatica.pulse.observability.PulseMetrics;
import org.pragmatica.pulse.window.WindowStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates incoming records, stamps them with the server receipt time and runs admission, aggregation and
 * detection for the affected series.
 * <p>
 * Validation happens before anything is admitted, so a rejected record leaves every window untouched. For each
 * admitted event the window update, the baseline computation and the classification run as one step under the
 * series lock; transitions are handed to the {@link AlertDispatcher}, which never blocks.
 * <p>
 * Client timestamps are only checked against the clock skew tolerance. Windowing always uses the receipt time;
 * an absent or unparseable client timestamp is ignored.
 */
public final class EventIngestor {
    private static final Logger log = LoggerFactory.getLogger(EventIngestor.class);

    private final Clock clock;
    private final Duration clockSkewTolerance;
    private final WindowStore windowStore;
    private final MetricsAggregator aggregator;
    private final AnomalyDetector detector;
    private final AlertDispatcher dispatcher;
    private final PulseMetrics metrics;

    private EventIngestor(Clock clock,
                          Duration clockSkewTolerance,
                          WindowStore windowStore,
                          MetricsAggregator aggregator,
                          AnomalyDetector detector,
                          AlertDispatcher dispatcher,
                          PulseMetrics metrics) {
        this.clock = clock;
        this.clockSkewTolerance = clockSkewTolerance;
        this.windowStore = windowStore;
        this.aggregator = aggregator;
        this.detector = detector;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    public static EventIngestor eventIngestor(Clock clock,
                                              Duration clockSkewTolerance,
                                              WindowStore windowStore,
                                              MetricsAggregator aggregator,
                                              AnomalyDetector detector,
                                              AlertDispatcher dispatcher,
                                              PulseMetrics metrics) {
        return new EventIngestor(clock, clockSkewTolerance, windowStore, aggregator, detector, dispatcher, metrics);
    }

    /**
     * Ingest a single-metric record.
     */
    public IngestResult ingest(RawRecord record) {
        var started = System.nanoTime();
        try{
            var now = clock.instant();
            var metric = MetricName.fromString(record.metric());
            var failure = validateKey(record.key(), "key")
                .or(() -> validateMetric(record.metric(), metric))
                .or(() -> validateValue(metric.get(), record.value(), "value"))
                .or(() -> validateTimestamp(record.timestamp(), now));
            if (failure.isPresent()) {
                return reject(failure.get());
            }
            var admission = admit(ApiEvent.apiEvent(record.key(), metric.get(), now, record.value()));
            return IngestResult.accepted(List.of(admission.event()), List.of(admission.anomaly()));
        } finally{
            metrics.recordIngestDuration(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    /**
     * Ingest a whole-call record as three events keyed by the user: latency, error (1 or 0) and volume (tokens).
     * The record is validated as a whole; on failure nothing is admitted.
     */
    public IngestResult ingestCall(ApiCallRecord record) {
        var started = System.nanoTime();
        try{
            var now = clock.instant();
            var failure = validateKey(record.userId(), "userId")
                .or(() -> validateValue(MetricName.LATENCY, record.latencyMs(), "latencyMs"))
                .or(() -> record.tokensUsed() == null
                          ? Optional.of(IngestError.missingField("tokensUsed"))
                          : validateValue(MetricName.VOLUME, record.tokensUsed()
                                                                   .doubleValue(), "tokensUsed"))
                .or(() -> record.error() == null
                          ? Optional.of(IngestError.missingField("error"))
                          : Optional.empty())
                .or(() -> validateTimestamp(record.timestamp(), now));
            if (failure.isPresent()) {
                return reject(failure.get());
            }
            var events = List.of(ApiEvent.apiEvent(record.userId(), MetricName.LATENCY, now, record.latencyMs()),
                                 ApiEvent.apiEvent(record.userId(),
                                                   MetricName.ERROR,
                                                   now,
                                                   record.error()
                                                   ? 1.0
                                                   : 0.0),
                                 ApiEvent.apiEvent(record.userId(),
                                                   MetricName.VOLUME,
                                                   now,
                                                   record.tokensUsed()
                                                         .doubleValue()));
            var admitted = new ArrayList<ApiEvent>(events.size());
            var evaluations = new ArrayList<Anomaly>(events.size());
            for (var event : events) {
                var admission = admit(event);
                admitted.add(admission.event());
                evaluations.add(admission.anomaly());
            }
            return IngestResult.accepted(admitted, evaluations);
        } finally{
            metrics.recordIngestDuration(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private record Admission(ApiEvent event, Anomaly anomaly) {}

    private Admission admit(ApiEvent event) {
        var admission = windowStore.update(event,
                                           view -> {
                                               var latest = view.latest()
                                                                .orElse(event);
                                               var anomaly = detector.evaluate(aggregator.baseline(view), latest);
                                               if (anomaly.isTransition()) {
                                                   dispatcher.notify(anomaly);
                                               }
                                               return new Admission(latest, anomaly);
                                           });
        metrics.recordAccepted(event.metric()
                                    .wireName());
        return admission;
    }

    private IngestResult reject(IngestError error) {
        log.debug("Record rejected: {}", error.message());
        metrics.recordRejected(error.reason());
        return IngestResult.rejected(error);
    }

    private static Optional<IngestError> validateKey(String key, String field) {
        if (key == null) {
            return Optional.of(IngestError.missingField(field));
        }
        if (key.isBlank()) {
            return Optional.of(IngestError.invalidValue(field, "must not be empty"));
        }
        return Optional.empty();
    }

    private static Optional<IngestError> validateMetric(String name, Optional<MetricName> metric) {
        if (name == null || name.isBlank()) {
            return Optional.of(IngestError.missingField("metric"));
        }
        return metric.isEmpty()
               ? Optional.of(IngestError.unknownMetric(name))
               : Optional.empty();
    }

    private static Optional<IngestError> validateValue(MetricName metric, Double value, String field) {
        if (value == null) {
            return Optional.of(IngestError.missingField(field));
        }
        if (!Double.isFinite(value)) {
            return Optional.of(IngestError.invalidValue(field, "must be a finite number. Got: " + value));
        }
        switch (metric) {
            case ERROR:
                if (value != 0.0 && value != 1.0) {
                    return Optional.of(IngestError.invalidValue(field, "error metric must be 0 or 1. Got: " + value));
                }
                return Optional.empty();
            default:
                if (value < 0) {
                    return Optional.of(IngestError.invalidValue(field, "must not be negative. Got: " + value));
                }
                return Optional.empty();
        }
    }

    private Optional<IngestError> validateTimestamp(String timestamp, Instant now) {
        return parseTimestamp(timestamp).filter(instant -> instant.isAfter(now.plus(clockSkewTolerance)))
                                        .map(instant -> IngestError.clockSkew(timestamp,
                                                                              clockSkewTolerance.toString()));
    }

    /**
     * Parse an ISO-8601 timestamp with or without an offset; a timestamp without one is taken as UTC.
     * Returns empty for an absent or unparseable value.
     */
    static Optional<Instant> parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Optional.empty();
        }
        try{
            var parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(timestamp.trim(),
                                                                   OffsetDateTime::from,
                                                                   LocalDateTime::from);
            return Optional.of(parsed instanceof OffsetDateTime offsetDateTime
                               ? offsetDateTime.toInstant()
                               : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}', using receipt time", timestamp);
            return Optional.empty();
        }
    }
}
