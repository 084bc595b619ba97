package org.pragmatica.pulse.ingest;

import org.pragmatica.pulse.model.Anomaly;
import org.pragmatica.pulse.model.ApiEvent;

import java.util.List;

/**
 * Outcome of ingesting one record.
 */
public sealed interface IngestResult {
    boolean isAccepted();

    /**
     * The record was admitted.
     *
     * @param events      Admitted events with their receipt timestamps, one per metric
     * @param evaluations Detector evaluation for each admitted event, in the same order
     */
    record Accepted(List<ApiEvent> events, List<Anomaly> evaluations) implements IngestResult {
        public Accepted {
            events = List.copyOf(events);
            evaluations = List.copyOf(evaluations);
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        /**
         * The first admitted event; the only one for a single-metric record.
         */
        public ApiEvent event() {
            return events.get(0);
        }

        /**
         * The first evaluation; the only one for a single-metric record.
         */
        public Anomaly anomaly() {
            return evaluations.get(0);
        }
    }

    record Rejected(IngestError error) implements IngestResult {
        @Override
        public boolean isAccepted() {
            return false;
        }
    }

    static IngestResult accepted(List<ApiEvent> events, List<Anomaly> evaluations) {
        return new Accepted(events, evaluations);
    }

    static IngestResult rejected(IngestError error) {
        return new Rejected(error);
    }
}
