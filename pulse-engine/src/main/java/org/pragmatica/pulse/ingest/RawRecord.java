package org.pragmatica.pulse.ingest;

/**
 * An unvalidated single-metric record as received from a transport.
 *
 * @param timestamp Optional client timestamp in ISO-8601 form
 * @param key       Series key, e.g. a user or endpoint identifier
 * @param metric    Metric name: latency, error or volume
 * @param value     Measured value
 */
public record RawRecord(String timestamp, String key, String metric, Double value) {
    public static RawRecord rawRecord(String key, String metric, Double value) {
        return new RawRecord(null, key, metric, value);
    }

    public static RawRecord rawRecord(String timestamp, String key, String metric, Double value) {
        return new RawRecord(timestamp, key, metric, value);
    }
}
