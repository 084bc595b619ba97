package org.pragmatica.pulse.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.pulse.MutableClock;
import org.pragmatica.pulse.aggregate.MetricsAggregator;
import org.pragmatica.pulse.alert.AlertDispatcher;
import org.pragmatica.pulse.config.PulseConfig;
import org.pragmatica.pulse.detect.AnomalyDetector;
import org.pragmatica.pulse.ingest.IngestResult.Accepted;
import org.pragmatica.pulse.ingest.IngestResult.Rejected;
import org.pragmatica.pulse.model.Anomaly;
import org.pragmatica.pulse.model.ApiEvent;
import org.pragmatica.pulse.model.MetricName;
import org.pragmatica.pulse.model.SeriesKey;
import org.pragmatica.pulse.model.Severity;
import org.pragmatica.pulse.observability.PulseMetrics;
import org.pragmatica.pulse.window.WindowStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class EventIngestorTest {
    private MutableClock clock;
    private PulseMetrics metrics;
    private WindowStore store;
    private MetricsAggregator aggregator;
    private AnomalyDetector detector;
    private AlertDispatcher dispatcher;
    private EventIngestor ingestor;

    @BeforeEach
    void setUp() {
        var config = PulseConfig.builder()
                                .window(Duration.ofSeconds(60))
                                .minSamples(3)
                                .clockSkewTolerance(Duration.ofSeconds(30))
                                .build();
        clock = MutableClock.atEpoch();
        metrics = PulseMetrics.inMemory();
        store = WindowStore.windowStore(config.window(), clock);
        aggregator = MetricsAggregator.metricsAggregator();
        detector = AnomalyDetector.anomalyDetector(config);
        dispatcher = AlertDispatcher.alertDispatcher(config.alerts(), metrics);
        ingestor = EventIngestor.eventIngestor(clock,
                                               config.clockSkewTolerance(),
                                               store,
                                               aggregator,
                                               detector,
                                               dispatcher,
                                               metrics);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private static Rejected rejected(IngestResult result) {
        assertThat(result).isInstanceOf(Rejected.class);
        return (Rejected) result;
    }

    private static Accepted accepted(IngestResult result) {
        assertThat(result).isInstanceOf(Accepted.class);
        return (Accepted) result;
    }

    // === Validation Tests ===

    @Test
    void ingest_rejects_whenTimestampBeyondSkewTolerance() {
        var future = clock.instant()
                          .plus(Duration.ofMinutes(10))
                          .toString();

        var error = rejected(ingestor.ingest(RawRecord.rawRecord(future, "user-1", "latency", 100.0))).error();

        assertThat(error).isInstanceOf(IngestError.ClockSkew.class);
        assertThat(store.seriesCount()).isZero();
        assertThat(metrics.registry()
                          .counter("pulse.ingest.rejected", "reason", "clock_skew")
                          .count()).isEqualTo(1.0);
    }

    @Test
    void ingest_accepts_whenTimestampWithinTolerance() {
        var nearFuture = clock.instant()
                              .plusSeconds(20)
                              .toString();

        assertThat(ingestor.ingest(RawRecord.rawRecord(nearFuture, "user-1", "latency", 100.0))
                           .isAccepted()).isTrue();
    }

    @Test
    void ingest_usesReceiptTime_regardlessOfClientTimestamp() {
        var past = clock.instant()
                        .minus(Duration.ofHours(3))
                        .toString();

        var event = accepted(ingestor.ingest(RawRecord.rawRecord(past, "user-1", "latency", 100.0))).event();

        assertThat(event.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void ingest_accepts_whenTimestampUnparseable() {
        var event = accepted(ingestor.ingest(RawRecord.rawRecord("yesterday-ish", "user-1", "latency", 1.0))).event();

        assertThat(event.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void ingest_rejects_whenKeyMissingOrBlank() {
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord(null, "latency", 1.0))).error())
            .isEqualTo(IngestError.missingField("key"));
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord("  ", "latency", 1.0))).error())
            .isInstanceOf(IngestError.InvalidValue.class);
    }

    @Test
    void ingest_rejects_whenMetricMissingOrUnknown() {
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord("user-1", null, 1.0))).error())
            .isEqualTo(IngestError.missingField("metric"));
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord("user-1", "throughput", 1.0))).error())
            .isEqualTo(IngestError.unknownMetric("throughput"));
    }

    @Test
    void ingest_acceptsMetricName_caseInsensitively() {
        var event = accepted(ingestor.ingest(RawRecord.rawRecord("user-1", " Latency ", 1.0))).event();

        assertThat(event.metric()).isEqualTo(MetricName.LATENCY);
    }

    @Test
    void ingest_rejects_whenValueMissingOrNotFinite() {
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", null))).error())
            .isEqualTo(IngestError.missingField("value"));
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", Double.NaN))).error())
            .isInstanceOf(IngestError.InvalidValue.class);
    }

    @Test
    void ingest_rejects_negativeLatencyAndVolume() {
        assertThat(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", -1.0))
                           .isAccepted()).isFalse();
        assertThat(ingestor.ingest(RawRecord.rawRecord("user-1", "volume", -0.5))
                           .isAccepted()).isFalse();
        assertThat(ingestor.ingest(RawRecord.rawRecord("user-1", "volume", 0.0))
                           .isAccepted()).isTrue();
    }

    @Test
    void ingest_acceptsOnlyZeroOrOne_forErrorMetric() {
        assertThat(ingestor.ingest(RawRecord.rawRecord("user-1", "error", 0.0))
                           .isAccepted()).isTrue();
        assertThat(ingestor.ingest(RawRecord.rawRecord("user-1", "error", 1.0))
                           .isAccepted()).isTrue();
        assertThat(rejected(ingestor.ingest(RawRecord.rawRecord("user-1", "error", 0.5))).error())
            .isInstanceOf(IngestError.InvalidValue.class);
    }

    @Test
    void ingest_rejection_leavesOtherSeriesUntouched() {
        ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 10.0));

        ingestor.ingest(RawRecord.rawRecord("user-1", "latency", -10.0));

        assertThat(store.snapshot("user-1", MetricName.LATENCY)).hasSize(1);
    }

    // === Detection Tests ===

    @Test
    void ingest_reportsCritical_forSpikeAfterStableTraffic() {
        for (int i = 0; i < 100; i++) {
            clock.advance(Duration.ofMillis(100));
            ingestor.ingest(RawRecord.rawRecord("user-1",
                                                "latency",
                                                i % 2 == 0
                                                ? 45.0
                                                : 55.0));
        }

        var anomaly = accepted(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 200.0))).anomaly();

        assertThat(anomaly.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.isTransition()).isTrue();
        assertThat(dispatcher.since(0)).hasSize(1);
    }

    @Test
    void ingest_flagsOutlier_thatWouldHideInItsOwnStatistics() {
        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofMillis(100));
            ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 100.0));
        }
        clock.advance(Duration.ofMillis(100));

        var anomaly = accepted(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 130.0))).anomaly();

        assertThat(anomaly.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.threshold()).isEqualTo(100.0);

        // With 130 inside the statistics: mean 105, stddev ~11.2, critical threshold ~138.5
        var inclusive = store.read(SeriesKey.seriesKey("user-1", MetricName.LATENCY), aggregator::compute)
                             .orElseThrow();
        assertThat(inclusive.count()).isEqualTo(6);
        assertThat(detector.classify(inclusive, 130.0)
                           .severity()).isNotEqualTo(Severity.CRITICAL);
    }

    @Test
    void ingest_absorbsSustainedShift_intoBaseline() {
        for (int i = 0; i < 20; i++) {
            clock.advance(Duration.ofMillis(100));
            ingestor.ingest(RawRecord.rawRecord("user-1",
                                                "latency",
                                                i % 2 == 0
                                                ? 95.0
                                                : 105.0));
        }
        var evaluations = new ArrayList<Anomaly>();
        for (int i = 0; i < 60; i++) {
            clock.advance(Duration.ofMillis(100));
            evaluations.add(accepted(ingestor.ingest(RawRecord.rawRecord("user-1",
                                                                         "latency",
                                                                         i % 2 == 0
                                                                         ? 195.0
                                                                         : 205.0))).anomaly());
        }

        assertThat(evaluations.get(0)
                              .severity()).isEqualTo(Severity.CRITICAL);
        assertThat(evaluations.get(evaluations.size() - 1)
                              .severity()).isEqualTo(Severity.HEALTHY);
        assertThat(dispatcher.since(0)).extracting(event -> event.anomaly()
                                                                 .severity())
                                       .startsWith(Severity.CRITICAL)
                                       .endsWith(Severity.HEALTHY);
    }

    @Test
    void ingestCall_reportsWarning_forSustainedErrorRate() {
        IngestResult last = null;
        for (int i = 0; i < 200; i++) {
            clock.advance(Duration.ofMillis(100));
            last = ingestor.ingestCall(ApiCallRecord.apiCallRecord("user-1", 100, 500, i % 2 == 0));
        }

        var error = accepted(last).evaluations()
                                  .stream()
                                  .filter(anomaly -> anomaly.metric() == MetricName.ERROR)
                                  .findFirst()
                                  .orElseThrow();
        assertThat(error.severity()).isEqualTo(Severity.WARNING);
        assertThat(error.threshold()).isEqualTo(0.10);
        assertThat(dispatcher.since(0)).extracting(event -> event.anomaly()
                                                                 .metric())
                                       .containsExactly(MetricName.ERROR);
    }

    @Test
    void ingest_staysHealthy_belowMinimumSamples() {
        ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 1.0));
        ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 1.0));

        var anomaly = accepted(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 1e9))).anomaly();

        assertThat(anomaly.severity()).isEqualTo(Severity.HEALTHY);
        assertThat(anomaly.insufficientSample()).isTrue();
        assertThat(dispatcher.since(0)).isEmpty();
    }

    @Test
    void ingest_evictsStaleEvents_beforeAggregation() {
        ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 1000.0));
        clock.advance(Duration.ofSeconds(61));

        var result = accepted(ingestor.ingest(RawRecord.rawRecord("user-1", "latency", 10.0)));

        assertThat(store.snapshot("user-1", MetricName.LATENCY)).extracting(ApiEvent::value)
                                                                 .containsExactly(10.0);
        assertThat(result.anomaly()
                         .insufficientSample()).isTrue();
    }

    // === Whole-call Tests ===

    @Test
    void ingestCall_fansOutIntoThreeSeries() {
        var result = accepted(ingestor.ingestCall(ApiCallRecord.apiCallRecord("user-7", 250, 1200, true)));

        assertThat(result.events()).extracting(ApiEvent::metric)
                                   .containsExactly(MetricName.LATENCY, MetricName.ERROR, MetricName.VOLUME);
        assertThat(result.events()).extracting(ApiEvent::value)
                                   .containsExactly(250.0, 1.0, 1200.0);
        assertThat(result.evaluations()).hasSize(3);
        assertThat(store.seriesCount()).isEqualTo(3);
        assertThat(metrics.registry()
                          .counter("pulse.ingest.accepted", "metric", "error")
                          .count()).isEqualTo(1.0);
    }

    @Test
    void ingestCall_admitsNothing_whenAnyFieldInvalid() {
        var result = ingestor.ingestCall(new ApiCallRecord(null, "user-7", 250.0, -5L, false));

        assertThat(rejected(result).error()).isInstanceOf(IngestError.InvalidValue.class);
        assertThat(store.seriesCount()).isZero();
    }

    @Test
    void ingestCall_rejects_whenErrorFlagMissing() {
        var result = ingestor.ingestCall(new ApiCallRecord(null, "user-7", 250.0, 5L, null));

        assertThat(rejected(result).error()).isEqualTo(IngestError.missingField("error"));
    }

    @Test
    void ingestCall_rejects_whenTimestampInFuture() {
        var future = "2024-01-01T00:10:00";

        var result = ingestor.ingestCall(new ApiCallRecord(future, "user-7", 250.0, 5L, false));

        assertThat(rejected(result).error()).isInstanceOf(IngestError.ClockSkew.class);
    }

    // === Timestamp Parsing Tests ===

    @Test
    void parseTimestamp_acceptsOffsetAndLocalForms() {
        assertThat(EventIngestor.parseTimestamp("2024-01-01T00:00:00Z")).contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(EventIngestor.parseTimestamp("2024-01-01T02:00:00+02:00"))
            .contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(EventIngestor.parseTimestamp("2024-01-01T00:00:00")).contains(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(EventIngestor.parseTimestamp("not a time")).isEmpty();
        assertThat(EventIngestor.parseTimestamp(null)).isEmpty();
    }
}
