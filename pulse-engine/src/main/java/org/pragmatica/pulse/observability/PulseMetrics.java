package org.pragmatica.pulse.observability;

import java.time.Duration;
import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

/**
 * Engine meters backed by Micrometer.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code pulse.ingest.accepted{metric}} - admitted events</li>
 *   <li>{@code pulse.ingest.rejected{reason}} - records rejected by validation</li>
 *   <li>{@code pulse.ingest.duration} - time spent validating, admitting and classifying a record</li>
 *   <li>{@code pulse.alerts.transitions{severity}} - severity transitions handed to the dispatcher</li>
 *   <li>{@code pulse.alerts.dropped{subscriber}} - alerts dropped because a subscriber queue was full;
 *   {@code subscriber="feed"} counts transitions overwritten in the alert history</li>
 *   <li>{@code pulse.series.active} - number of retained (key, metric) series</li>
 * </ul>
 */
public interface PulseMetrics {
    /**
     * Get the underlying Micrometer registry.
     */
    MeterRegistry registry();

    /**
     * Prometheus exposition text, empty when the registry is not a Prometheus registry.
     */
    String scrape();

    void recordAccepted(String metric);

    void recordRejected(String reason);

    void recordIngestDuration(Duration duration);

    void recordTransition(String severity);

    void recordDropped(String subscriber);

    /**
     * Register a gauge backed by a supplier.
     */
    Gauge gauge(String name, Supplier<Number> supplier, String... tags);

    /**
     * Metrics with Prometheus backend.
     */
    static PulseMetrics prometheus() {
        return pulseMetrics(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    /**
     * Metrics kept in memory only; suitable for tests and embedded use.
     */
    static PulseMetrics inMemory() {
        return pulseMetrics(new SimpleMeterRegistry());
    }

    /**
     * Metrics recorded into a registry owned by the caller.
     */
    static PulseMetrics pulseMetrics(MeterRegistry registry) {
        return new MicrometerPulseMetrics(registry);
    }

    record MicrometerPulseMetrics(MeterRegistry registry) implements PulseMetrics {
        @Override
        public String scrape() {
            return registry instanceof PrometheusMeterRegistry prometheusRegistry
                   ? prometheusRegistry.scrape()
                   : "";
        }

        @Override
        public void recordAccepted(String metric) {
            counter("pulse.ingest.accepted", "metric", metric).increment();
        }

        @Override
        public void recordRejected(String reason) {
            counter("pulse.ingest.rejected", "reason", reason).increment();
        }

        @Override
        public void recordIngestDuration(Duration duration) {
            Timer.builder("pulse.ingest.duration")
                 .description("Time to validate, admit and classify one record")
                 .register(registry)
                 .record(duration);
        }

        @Override
        public void recordTransition(String severity) {
            counter("pulse.alerts.transitions", "severity", severity).increment();
        }

        @Override
        public void recordDropped(String subscriber) {
            counter("pulse.alerts.dropped", "subscriber", subscriber).increment();
        }

        @Override
        public Gauge gauge(String name, Supplier<Number> supplier, String... tags) {
            return Gauge.builder(name,
                                 () -> supplier.get()
                                               .doubleValue())
                        .tags(tags)
                        .register(registry);
        }

        private Counter counter(String name, String... tags) {
            return registry.counter(name, tags);
        }
    }
}
