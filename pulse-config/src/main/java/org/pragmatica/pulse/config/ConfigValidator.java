package org.pragmatica.pulse.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates Pulse configuration.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Window duration must be positive</li>
 *   <li>k_warning must be a finite non-negative number</li>
 *   <li>k_critical must be finite and not below k_warning</li>
 *   <li>Minimum sample count must be at least 1</li>
 *   <li>max_error_rate must be between 0 and 1</li>
 *   <li>Clock skew tolerance must not be negative</li>
 *   <li>Alert queue and history capacities must be positive</li>
 * </ul>
 */
public final class ConfigValidator {
    private ConfigValidator() {}

    /**
     * Validate configuration, reporting all violations at once.
     *
     * @return the same configuration when valid
     * @throws ConfigurationException carrying {@link ConfigError.ValidationFailed} otherwise
     */
    public static PulseConfig validate(PulseConfig config) {
        var errors = violations(config);
        if (errors.isEmpty()) {
            return config;
        }
        throw new ConfigurationException(ConfigError.validationFailed(errors));
    }

    static List<String> violations(PulseConfig config) {
        var errors = new ArrayList<String>();
        validateWindow(config.window(), errors);
        validateThresholds(config.kWarning(), config.kCritical(), errors);
        if (config.minSamples() < 1) {
            errors.add("Minimum sample count must be at least 1. Got: " + config.minSamples());
        }
        if (!(config.maxErrorRate() >= 0 && config.maxErrorRate() <= 1)) {
            errors.add("max_error_rate must be between 0 and 1. Got: " + config.maxErrorRate());
        }
        validateSkew(config.clockSkewTolerance(), errors);
        validateAlerts(config.alerts(), errors);
        return errors;
    }

    private static void validateWindow(Duration window, List<String> errors) {
        if (window == null) {
            errors.add("Window duration is required");
        } else if (window.isNegative() || window.isZero()) {
            errors.add("Window duration must be positive. Got: " + window);
        }
    }

    private static void validateThresholds(double kWarning, double kCritical, List<String> errors) {
        if (!Double.isFinite(kWarning) || kWarning < 0) {
            errors.add("k_warning must be a finite non-negative number. Got: " + kWarning);
        }
        if (!Double.isFinite(kCritical)) {
            errors.add("k_critical must be a finite number. Got: " + kCritical);
        } else if (kCritical < kWarning) {
            errors.add("k_critical must not be below k_warning. Got: k_critical=" + kCritical + ", k_warning="
                       + kWarning);
        }
    }

    private static void validateSkew(Duration tolerance, List<String> errors) {
        if (tolerance == null) {
            errors.add("Clock skew tolerance is required");
        } else if (tolerance.isNegative()) {
            errors.add("Clock skew tolerance must not be negative. Got: " + tolerance);
        }
    }

    private static void validateAlerts(AlertConfig alerts, List<String> errors) {
        if (alerts == null) {
            errors.add("Alert configuration is required");
            return;
        }
        if (alerts.queueCapacity() < 1) {
            errors.add("alerts.queue_capacity must be positive. Got: " + alerts.queueCapacity());
        }
        if (alerts.historyCapacity() < 1) {
            errors.add("alerts.history_capacity must be positive. Got: " + alerts.historyCapacity());
        }
        if (alerts.webhook() == null) {
            errors.add("alerts.webhook configuration is required");
        } else {
            alerts.webhook()
                  .validate(errors);
        }
    }
}
