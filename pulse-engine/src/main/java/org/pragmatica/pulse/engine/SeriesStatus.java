package org.pragmatica.pulse.engine;

import org.pragmatica.pulse.model.MetricsSnapshot;
import org.pragmatica.pulse.model.Severity;

/**
 * Current statistics of a series together with its last reported severity.
 */
public record SeriesStatus(MetricsSnapshot snapshot, Severity severity) {}
