package org.pragmatica.pulse.config;

import java.util.List;

/**
 * Configuration errors. All of them are fatal: an engine is never started with an invalid configuration.
 */
public sealed interface ConfigError {
    String message();

    /**
     * One or more configuration values violate their constraints.
     */
    record ValidationFailed(List<String> errors) implements ConfigError {
        @Override
        public String message() {
            return "Configuration validation failed:\n- " + String.join("\n- ", errors);
        }
    }

    /**
     * Configuration source could not be read or parsed.
     */
    record InvalidConfig(String reason) implements ConfigError {
        @Override
        public String message() {
            return "Invalid configuration: " + reason;
        }
    }

    static ConfigError validationFailed(List<String> errors) {
        return new ValidationFailed(List.copyOf(errors));
    }

    static ConfigError invalidConfig(String reason) {
        return new InvalidConfig(reason);
    }
}
