package org.pragmatica.pulse.detect;

import org.pragmatica.pulse.model.Severity;

/**
 * Outcome of applying the k-sigma rule to one observation.
 *
 * @param severity           Classified severity
 * @param threshold          Boundary the observation was compared against: the critical boundary for CRITICAL,
 *                           the warning boundary otherwise
 * @param insufficientSample True when detection was suppressed for lack of baseline samples
 */
public record Classification(Severity severity, double threshold, boolean insufficientSample) {}
