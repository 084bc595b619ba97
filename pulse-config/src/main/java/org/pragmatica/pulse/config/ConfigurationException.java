package org.pragmatica.pulse.config;

/**
 * Thrown at startup when configuration cannot be loaded or is invalid.
 */
public final class ConfigurationException extends RuntimeException {
    private final ConfigError error;

    public ConfigurationException(ConfigError error) {
        super(error.message());
        this.error = error;
    }

    public ConfigurationException(ConfigError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ConfigError error() {
        return error;
    }
}
