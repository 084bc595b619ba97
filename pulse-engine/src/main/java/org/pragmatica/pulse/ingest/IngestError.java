package org.pragmatica.pulse.ingest;

/**
 * Reasons a record is rejected. Client-caused and local to the record: nothing is admitted and no other series
 * is affected.
 */
public sealed interface IngestError {
    String message();

    /**
     * Short code used as the rejection meter tag.
     */
    String reason();

    record MissingField(String field) implements IngestError {
        @Override
        public String message() {
            return "Missing required field: " + field;
        }

        @Override
        public String reason() {
            return "missing_field";
        }
    }

    record InvalidValue(String field, String detail) implements IngestError {
        @Override
        public String message() {
            return "Invalid value for " + field + ": " + detail;
        }

        @Override
        public String reason() {
            return "invalid_value";
        }
    }

    record UnknownMetric(String metric) implements IngestError {
        @Override
        public String message() {
            return "Unknown metric: " + metric + ". Expected one of latency, error, volume";
        }

        @Override
        public String reason() {
            return "unknown_metric";
        }
    }

    record ClockSkew(String timestamp, String tolerance) implements IngestError {
        @Override
        public String message() {
            return "Timestamp " + timestamp + " is more than " + tolerance + " in the future";
        }

        @Override
        public String reason() {
            return "clock_skew";
        }
    }

    static IngestError missingField(String field) {
        return new MissingField(field);
    }

    static IngestError invalidValue(String field, String detail) {
        return new InvalidValue(field, detail);
    }

    static IngestError unknownMetric(String metric) {
        return new UnknownMetric(metric);
    }

    static IngestError clockSkew(String timestamp, String tolerance) {
        return new ClockSkew(timestamp, tolerance);
    }
}
