package org.pragmatica.pulse.alert;

import org.pragmatica.pulse.model.Anomaly;

/**
 * A severity transition as published by the dispatcher.
 *
 * @param sequence Position in the alert feed, strictly increasing from 1
 * @param anomaly  The transition
 */
public record AlertEvent(long sequence, Anomaly anomaly) {}
