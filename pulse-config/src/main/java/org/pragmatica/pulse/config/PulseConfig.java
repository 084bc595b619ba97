package org.pragmatica.pulse.config;

import java.time.Duration;

/**
 * Engine configuration. Constructed once at startup and immutable for the lifetime of the process.
 *
 * @param window             Sliding window duration W
 * @param kWarning           Standard deviations above the baseline mean that classify as WARNING
 * @param kCritical          Standard deviations above the baseline mean that classify as CRITICAL
 * @param minSamples         Baseline sample count below which detection is suppressed
 * @param maxErrorRate       Error rate over the window above which an error series is at least WARNING
 * @param clockSkewTolerance How far in the future a client timestamp may be before the record is rejected
 * @param alerts             Alert dispatch configuration
 */
public record PulseConfig(Duration window,
                          double kWarning,
                          double kCritical,
                          int minSamples,
                          double maxErrorRate,
                          Duration clockSkewTolerance,
                          AlertConfig alerts) {
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(2);
    public static final double DEFAULT_K_WARNING = 2.0;
    public static final double DEFAULT_K_CRITICAL = 3.0;
    public static final int DEFAULT_MIN_SAMPLES = 5;
    public static final double DEFAULT_MAX_ERROR_RATE = 0.10;
    public static final Duration DEFAULT_CLOCK_SKEW_TOLERANCE = Duration.ofSeconds(30);

    /**
     * Default configuration: 2 minute window, 2 and 3 sigma thresholds, 5 baseline samples, 10% error rate.
     */
    public static PulseConfig defaults() {
        return builder().build();
    }

    /**
     * Create a validated configuration.
     *
     * @throws ConfigurationException if any value is invalid
     */
    public static PulseConfig pulseConfig(Duration window,
                                          double kWarning,
                                          double kCritical,
                                          int minSamples,
                                          double maxErrorRate,
                                          Duration clockSkewTolerance,
                                          AlertConfig alerts) {
        return ConfigValidator.validate(new PulseConfig(window,
                                                        kWarning,
                                                        kCritical,
                                                        minSamples,
                                                        maxErrorRate,
                                                        clockSkewTolerance,
                                                        alerts));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().window(window)
                            .kWarning(kWarning)
                            .kCritical(kCritical)
                            .minSamples(minSamples)
                            .maxErrorRate(maxErrorRate)
                            .clockSkewTolerance(clockSkewTolerance)
                            .alerts(alerts);
    }

    public static final class Builder {
        private Duration window = DEFAULT_WINDOW;
        private double kWarning = DEFAULT_K_WARNING;
        private double kCritical = DEFAULT_K_CRITICAL;
        private int minSamples = DEFAULT_MIN_SAMPLES;
        private double maxErrorRate = DEFAULT_MAX_ERROR_RATE;
        private Duration clockSkewTolerance = DEFAULT_CLOCK_SKEW_TOLERANCE;
        private AlertConfig alerts = AlertConfig.defaults();

        private Builder() {}

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder kWarning(double kWarning) {
            this.kWarning = kWarning;
            return this;
        }

        public Builder kCritical(double kCritical) {
            this.kCritical = kCritical;
            return this;
        }

        public Builder minSamples(int minSamples) {
            this.minSamples = minSamples;
            return this;
        }

        public Builder maxErrorRate(double maxErrorRate) {
            this.maxErrorRate = maxErrorRate;
            return this;
        }

        public Builder clockSkewTolerance(Duration clockSkewTolerance) {
            this.clockSkewTolerance = clockSkewTolerance;
            return this;
        }

        public Builder alerts(AlertConfig alerts) {
            this.alerts = alerts;
            return this;
        }

        /**
         * @throws ConfigurationException if any value is invalid
         */
        public PulseConfig build() {
            return pulseConfig(window, kWarning, kCritical, minSamples, maxErrorRate, clockSkewTolerance, alerts);
        }
    }
}
