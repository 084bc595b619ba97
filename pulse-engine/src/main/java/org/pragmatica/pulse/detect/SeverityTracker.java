package org.pragmatica.pulse.detect;

import org.pragmatica.pulse.model.Severity;

/**
 * Severity state machine for one series. Starts HEALTHY.
 * <p>
 * Writes happen under the owning series lock; reads may come from any thread.
 */
final class SeverityTracker {
    private volatile Severity current = Severity.HEALTHY;

    Severity current() {
        return current;
    }

    /**
     * Move to the given state.
     *
     * @return the state reported before this call
     */
    Severity advance(Severity next) {
        var previous = current;
        current = next;
        return previous;
    }
}
