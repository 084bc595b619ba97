package org.pragmatica.pulse.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    void loadFromString_parsesMinimalConfig() {
        var toml = """
            [window]
            duration = "60s"
            """;

        var config = ConfigLoader.loadFromString(toml);

        assertThat(config.window()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.kWarning()).isEqualTo(PulseConfig.DEFAULT_K_WARNING);
        assertThat(config.kCritical()).isEqualTo(PulseConfig.DEFAULT_K_CRITICAL);
    }

    @Test
    void loadFromString_parsesFullConfig() {
        var toml = """
            [window]
            duration = "5m"

            [detection]
            k_warning = 1.5
            k_critical = 4
            min_samples = 10
            max_error_rate = 0.2

            [ingest]
            clock_skew_tolerance = "500ms"

            [alerts]
            queue_capacity = 32
            history_capacity = 200

            [alerts.webhook]
            enabled = true
            urls = ["http://localhost:9000/hook"]
            retry_count = 2
            timeout_ms = 1000
            """;

        var config = ConfigLoader.loadFromString(toml);

        assertThat(config.window()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.kWarning()).isEqualTo(1.5);
        assertThat(config.kCritical()).isEqualTo(4.0);
        assertThat(config.minSamples()).isEqualTo(10);
        assertThat(config.maxErrorRate()).isEqualTo(0.2);
        assertThat(config.clockSkewTolerance()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.alerts().queueCapacity()).isEqualTo(32);
        assertThat(config.alerts().historyCapacity()).isEqualTo(200);
        assertThat(config.alerts().webhook().enabled()).isTrue();
        assertThat(config.alerts().webhook().urls()).containsExactly("http://localhost:9000/hook");
        assertThat(config.alerts().webhook().retryCount()).isEqualTo(2);
        assertThat(config.alerts().webhook().timeoutMs()).isEqualTo(1000);
    }

    @Test
    void loadFromString_usesDefaultsForEmptyDocument() {
        var config = ConfigLoader.loadFromString("");

        assertThat(config).isEqualTo(PulseConfig.defaults());
    }

    @Test
    void loadFromString_acceptsIntegerSecondsForDurations() {
        var toml = """
            [window]
            duration = 90
            """;

        assertThat(ConfigLoader.loadFromString(toml).window()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void loadFromString_fails_whenThresholdsInverted() {
        var toml = """
            [detection]
            k_warning = 3.0
            k_critical = 2.0
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("k_critical must not be below k_warning");
    }

    @Test
    void loadFromString_fails_whenThresholdNotNumeric() {
        var toml = """
            [detection]
            k_warning = "high"
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOfSatisfying(ConfigurationException.class,
                                    e -> assertThat(e.error()).isInstanceOf(ConfigError.InvalidConfig.class))
            .hasMessageContaining("detection.k_warning must be a number");
    }

    @Test
    void loadFromString_fails_whenMinSamplesFractional() {
        var toml = """
            [detection]
            min_samples = 2.9
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOfSatisfying(ConfigurationException.class,
                                    e -> assertThat(e.error()).isInstanceOf(ConfigError.InvalidConfig.class))
            .hasMessageContaining("detection.min_samples must be an integer");
    }

    @Test
    void loadFromString_fails_whenAlertCapacityNotInteger() {
        var toml = """
            [alerts]
            queue_capacity = "abc"
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("alerts.queue_capacity must be an integer");
    }

    @Test
    void loadFromString_fails_whenIntegerOutOfRange() {
        var toml = """
            [alerts.webhook]
            timeout_ms = 9999999999
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("alerts.webhook.timeout_ms must be an integer");
    }

    @Test
    void loadFromString_fails_whenWebhookFlagNotBoolean() {
        var toml = """
            [alerts.webhook]
            enabled = "yes"
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("alerts.webhook.enabled must be true or false");
    }

    @Test
    void loadFromString_fails_whenMaxErrorRateAboveOne() {
        var toml = """
            [detection]
            max_error_rate = 10
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("max_error_rate must be between 0 and 1");
    }

    @Test
    void loadFromString_fails_whenDurationMalformed() {
        var toml = """
            [window]
            duration = "soon"
            """;

        assertThatThrownBy(() -> ConfigLoader.loadFromString(toml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid configuration");
    }

    @Test
    void loadFromString_fails_whenTomlMalformed() {
        assertThatThrownBy(() -> ConfigLoader.loadFromString("[window\nduration ="))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid configuration");
    }

    @Test
    void loadWithOverrides_overridesFileValues(@TempDir Path dir) throws IOException {
        var file = dir.resolve("pulse.toml");
        Files.writeString(file, """
            [window]
            duration = "60s"

            [detection]
            min_samples = 5
            """);

        var config = ConfigLoader.loadWithOverrides(file,
                                                    Map.of("window", "2m", "min_samples", "20", "max_error_rate", "0.05"));

        assertThat(config.window()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.minSamples()).isEqualTo(20);
        assertThat(config.maxErrorRate()).isEqualTo(0.05);
    }

    @Test
    void load_fails_whenFileMissing(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.load(dir.resolve("absent.toml")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("cannot read");
    }

    @Test
    void parseDuration_handlesUnits() {
        assertThat(ConfigLoader.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(ConfigLoader.parseDuration("45s")).isEqualTo(Duration.ofSeconds(45));
        assertThat(ConfigLoader.parseDuration("3m")).isEqualTo(Duration.ofMinutes(3));
        assertThat(ConfigLoader.parseDuration("1h")).isEqualTo(Duration.ofHours(1));
        assertThat(ConfigLoader.parseDuration(" 12 ")).isEqualTo(Duration.ofSeconds(12));
    }
}
