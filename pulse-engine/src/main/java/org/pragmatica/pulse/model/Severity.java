package org.pragmatica.pulse.model;

/**
 * Severity levels, ordered by increasing deviation from the baseline.
 */
public enum Severity {
    HEALTHY,
    WARNING,
    CRITICAL;

    public boolean isWorseThan(Severity other) {
        return compareTo(other) > 0;
    }
}
