package org.pragmatica.pulse.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;

/**
 * JSON rendering of alerts for external consumers.
 */
public final class AlertJson {
    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule())
                                                                 .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AlertJson() {}

    /**
     * Wire form of a transition.
     */
    record AlertPayload(String type,
                        long sequence,
                        String key,
                        String metric,
                        String severity,
                        String previousSeverity,
                        double observedValue,
                        double threshold,
                        boolean insufficientSample,
                        Instant timestamp) {}

    public static String toJson(AlertEvent event) {
        var anomaly = event.anomaly();
        var payload = new AlertPayload("SEVERITY_TRANSITION",
                                       event.sequence(),
                                       anomaly.key(),
                                       anomaly.metric()
                                              .wireName(),
                                       anomaly.severity()
                                              .name(),
                                       anomaly.previousSeverity()
                                              .name(),
                                       anomaly.observedValue(),
                                       anomaly.threshold(),
                                       anomaly.insufficientSample(),
                                       anomaly.timestamp());
        try{
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize alert " + event.sequence(), e);
        }
    }
}
