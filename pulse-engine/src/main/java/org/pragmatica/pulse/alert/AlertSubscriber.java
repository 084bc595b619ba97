package org.pragmatica.pulse.alert;

/**
 * Push consumer of severity transitions. Invoked on the subscription's own delivery thread, never on the
 * ingestion path, so implementations may block (e.g. on network I/O).
 */
@FunctionalInterface
public interface AlertSubscriber {
    void onAlert(AlertEvent event);
}
