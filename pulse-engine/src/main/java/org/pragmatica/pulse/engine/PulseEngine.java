package org.pragmatica.pulse.engine;

import org.pragmatica.pulse.aggregate.MetricsAggregator;
import org.pragmatica.pulse.alert.AlertDispatcher;
import org.pragmatica.pulse.alert.AlertEvent;
import org.pragmatica.pulse.alert.AlertSubscriber;
import org.pragmatica.pulse.alert.Subscription;
import org.pragmatica.pulse.alert.WebhookAlertSubscriber;
import org.pragmatica.pulse.config.ConfigValidator;
import org.pragmatica.pulse.config.PulseConfig;
import org.pragmatica.pulse.detect.AnomalyDetector;
import org.pragmatica.pulse.ingest.ApiCallRecord;
import org.pragmatica.pulse.ingest.EventIngestor;
import org.pragmatica.pulse.ingest.IngestResult;
import org.pragmatica.pulse.ingest.RawRecord;
import org.pragmatica.pulse.model.MetricName;
import org.pragmatica.pulse.model.SeriesKey;
import org.pragmatica.pulse.observability.PulseMetrics;
import org.pragmatica.pulse.window.WindowStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming API-health engine. Assembles the window store, aggregator, detector, ingestor and alert dispatcher
 * from one immutable configuration.
 * <p>
 * All operations are safe to call concurrently. Ingestion on different series never contends; queries copy a
 * series window under its lock and return immutable values.
 */
public interface PulseEngine extends AutoCloseable {
    /**
     * Validate and admit a single-metric record, then classify it against its series baseline.
     */
    IngestResult ingest(RawRecord record);

    /**
     * Validate and admit a whole API call as latency, error and volume events keyed by the user.
     */
    IngestResult ingestCall(ApiCallRecord record);

    /**
     * Current statistics and severity of a series. Empty for a series never seen.
     */
    Optional<SeriesStatus> status(String key, MetricName metric);

    /**
     * Retained transitions with a sequence number greater than the given one, oldest first.
     */
    List<AlertEvent> alertsSince(long sequence);

    /**
     * Sequence number of the oldest transition still retained, 0 when none. A reader whose last seen sequence is
     * below {@code oldestAlertSequence() - 1} has missed overwritten transitions.
     */
    long oldestAlertSequence();

    /**
     * Push channel for transitions published from now on. Close the subscription to stop delivery.
     */
    Subscription subscribe(String name, AlertSubscriber subscriber);

    /**
     * Service-wide figures over the current windows.
     */
    ServiceSummary summary();

    /**
     * Alerts dropped since start, by subscriber queues and by the history overwriting its oldest entries.
     */
    long droppedAlerts();

    PulseConfig config();

    PulseMetrics metrics();

    @Override
    void close();

    static PulseEngine pulseEngine(PulseConfig config) {
        return pulseEngine(config, Clock.systemUTC(), PulseMetrics.prometheus());
    }

    /**
     * @throws org.pragmatica.pulse.config.ConfigurationException if the configuration is invalid
     */
    static PulseEngine pulseEngine(PulseConfig config, Clock clock, PulseMetrics metrics) {
        record pulseEngine(PulseConfig config,
                           Clock clock,
                           PulseMetrics metrics,
                           WindowStore windowStore,
                           MetricsAggregator aggregator,
                           AnomalyDetector detector,
                           AlertDispatcher dispatcher,
                           EventIngestor ingestor) implements PulseEngine {
            private static final Logger log = LoggerFactory.getLogger(pulseEngine.class);

            @Override
            public IngestResult ingest(RawRecord record) {
                return ingestor.ingest(record);
            }

            @Override
            public IngestResult ingestCall(ApiCallRecord record) {
                return ingestor.ingestCall(record);
            }

            @Override
            public Optional<SeriesStatus> status(String key, MetricName metric) {
                var series = SeriesKey.seriesKey(key, metric);
                return windowStore.read(series,
                                        view -> new SeriesStatus(aggregator.compute(view),
                                                                 detector.severity(series)));
            }

            @Override
            public List<AlertEvent> alertsSince(long sequence) {
                return dispatcher.since(sequence);
            }

            @Override
            public long oldestAlertSequence() {
                return dispatcher.oldestSequence();
            }

            @Override
            public Subscription subscribe(String name, AlertSubscriber subscriber) {
                return dispatcher.subscribe(name, subscriber);
            }

            @Override
            public ServiceSummary summary() {
                var calculator = new SummaryCalculator(windowStore.window(), clock.instant());
                for (var series : windowStore.seriesKeys()) {
                    windowStore.read(series, view -> view.events())
                               .ifPresent(events -> calculator.add(series, events));
                }
                return calculator.summary(detector.activeAnomalies());
            }

            @Override
            public long droppedAlerts() {
                return dispatcher.droppedCount();
            }

            @Override
            public void close() {
                dispatcher.close();
                log.info("Pulse engine stopped, {} series tracked", windowStore.seriesCount());
            }
        }

        var validated = ConfigValidator.validate(config);
        var aggregator = MetricsAggregator.metricsAggregator();
        var detector = AnomalyDetector.anomalyDetector(validated);
        var dispatcher = AlertDispatcher.alertDispatcher(validated.alerts(), metrics);
        // A series whose window emptied out is forgotten; an open anomaly on it recovers
        var windowStore = WindowStore.windowStore(validated.window(),
                                                  clock,
                                                  key -> detector.retire(key, clock.instant())
                                                                 .ifPresent(dispatcher::notify));
        var ingestor = EventIngestor.eventIngestor(clock,
                                                   validated.clockSkewTolerance(),
                                                   windowStore,
                                                   aggregator,
                                                   detector,
                                                   dispatcher,
                                                   metrics);
        var webhook = validated.alerts()
                               .webhook();
        if (webhook.enabled()) {
            dispatcher.subscribe("webhook", WebhookAlertSubscriber.webhookAlertSubscriber(webhook));
        }
        metrics.gauge("pulse.series.active", windowStore::seriesCount);
        LoggerFactory.getLogger(PulseEngine.class)
                     .info("Pulse engine started: window {}, k_warning {}, k_critical {}, min_samples {}, max_error_rate {}",
                           validated.window(),
                           validated.kWarning(),
                           validated.kCritical(),
                           validated.minSamples(),
                           validated.maxErrorRate());
        return new pulseEngine(validated, clock, metrics, windowStore, aggregator, detector, dispatcher, ingestor);
    }
}
