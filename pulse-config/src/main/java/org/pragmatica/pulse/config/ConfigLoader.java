package org.pragmatica.pulse.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads Pulse configuration from TOML files.
 *
 * <p>Configuration resolution order (highest priority first):
 * <ol>
 *   <li>Explicit overrides (e.g. command line)</li>
 *   <li>Values from TOML file</li>
 *   <li>Defaults from {@link PulseConfig}</li>
 * </ol>
 *
 * <p>Example pulse.toml:
 * <pre>
 * [window]
 * duration = "60s"
 *
 * [detection]
 * k_warning = 2.0
 * k_critical = 3.0
 * min_samples = 5
 * max_error_rate = 0.10
 *
 * [ingest]
 * clock_skew_tolerance = "30s"
 * </pre>
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {}

    /**
     * Load configuration from file path.
     *
     * @throws ConfigurationException if the file cannot be read, parsed or validated
     */
    public static PulseConfig load(Path path) {
        return loadWithOverrides(path, Map.of());
    }

    /**
     * Load configuration from TOML string content.
     *
     * @throws ConfigurationException if the content cannot be parsed or validated
     */
    public static PulseConfig loadFromString(String content) {
        return fromDocument(parse(content), Map.of());
    }

    /**
     * Load configuration with overrides. Recognized override keys: {@code window}, {@code k_warning},
     * {@code k_critical}, {@code min_samples}, {@code max_error_rate}, {@code clock_skew_tolerance}.
     *
     * @throws ConfigurationException if the file cannot be read, parsed or validated
     */
    public static PulseConfig loadWithOverrides(Path path, Map<String, String> overrides) {
        try{
            var config = fromDocument(parse(Files.readString(path)), overrides);
            log.info("Loaded configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException(ConfigError.invalidConfig("cannot read " + path + ": " + e.getMessage()),
                                             e);
        }
    }

    private static JsonNode parse(String content) {
        try{
            var doc = MAPPER.readTree(content);
            return doc == null
                   ? MissingNode.getInstance()
                   : doc;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(ConfigError.invalidConfig(e.getOriginalMessage()), e);
        }
    }

    private static PulseConfig fromDocument(JsonNode doc, Map<String, String> overrides) {
        try{
            var builder = PulseConfig.builder();
            var window = doc.path("window");
            var detection = doc.path("detection");
            var ingest = doc.path("ingest");
            if (!window.path("duration")
                       .isMissingNode()) {
                builder.window(durationOf(window.path("duration")));
            }
            if (!detection.path("k_warning")
                          .isMissingNode()) {
                builder.kWarning(numberOf(detection.path("k_warning"), "detection.k_warning"));
            }
            if (!detection.path("k_critical")
                          .isMissingNode()) {
                builder.kCritical(numberOf(detection.path("k_critical"), "detection.k_critical"));
            }
            if (!detection.path("min_samples")
                          .isMissingNode()) {
                builder.minSamples(integerOf(detection.path("min_samples"), "detection.min_samples"));
            }
            if (!detection.path("max_error_rate")
                          .isMissingNode()) {
                builder.maxErrorRate(numberOf(detection.path("max_error_rate"), "detection.max_error_rate"));
            }
            if (!ingest.path("clock_skew_tolerance")
                       .isMissingNode()) {
                builder.clockSkewTolerance(durationOf(ingest.path("clock_skew_tolerance")));
            }
            builder.alerts(alertsOf(doc.path("alerts")));
            // Overrides take precedence over file values
            if (overrides.containsKey("window")) {
                builder.window(parseDuration(overrides.get("window")));
            }
            if (overrides.containsKey("k_warning")) {
                builder.kWarning(Double.parseDouble(overrides.get("k_warning")));
            }
            if (overrides.containsKey("k_critical")) {
                builder.kCritical(Double.parseDouble(overrides.get("k_critical")));
            }
            if (overrides.containsKey("min_samples")) {
                builder.minSamples(Integer.parseInt(overrides.get("min_samples")));
            }
            if (overrides.containsKey("max_error_rate")) {
                builder.maxErrorRate(Double.parseDouble(overrides.get("max_error_rate")));
            }
            if (overrides.containsKey("clock_skew_tolerance")) {
                builder.clockSkewTolerance(parseDuration(overrides.get("clock_skew_tolerance")));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ConfigError.invalidConfig(e.getMessage()), e);
        }
    }

    private static AlertConfig alertsOf(JsonNode alerts) {
        if (alerts.isMissingNode()) {
            return AlertConfig.defaults();
        }
        var queueCapacity = integerOf(alerts.path("queue_capacity"),
                                      "alerts.queue_capacity",
                                      AlertConfig.DEFAULT_QUEUE_CAPACITY);
        var historyCapacity = integerOf(alerts.path("history_capacity"),
                                        "alerts.history_capacity",
                                        AlertConfig.DEFAULT_HISTORY_CAPACITY);
        var webhook = alerts.path("webhook");
        if (webhook.isMissingNode()) {
            return AlertConfig.alertConfig(queueCapacity, historyCapacity, AlertConfig.WebhookConfig.disabled());
        }
        var enabled = webhook.path("enabled");
        if (!enabled.isMissingNode() && !enabled.isBoolean()) {
            throw new IllegalArgumentException("alerts.webhook.enabled must be true or false. Got: " + enabled.asText());
        }
        var urls = new ArrayList<String>();
        webhook.path("urls")
               .forEach(url -> urls.add(url.asText()));
        return AlertConfig.alertConfig(queueCapacity,
                                       historyCapacity,
                                       AlertConfig.WebhookConfig.webhookConfig(enabled.asBoolean(false),
                                                                               urls,
                                                                               integerOf(webhook.path("retry_count"),
                                                                                         "alerts.webhook.retry_count",
                                                                                         3),
                                                                               integerOf(webhook.path("timeout_ms"),
                                                                                         "alerts.webhook.timeout_ms",
                                                                                         5000)));
    }

    private static int integerOf(JsonNode node, String name, int defaultValue) {
        return node.isMissingNode()
               ? defaultValue
               : integerOf(node, name);
    }

    private static int integerOf(JsonNode node, String name) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException(name + " must be an integer. Got: " + node.asText());
        }
        return node.asInt();
    }

    private static double numberOf(JsonNode node, String name) {
        if (!node.isNumber()) {
            throw new IllegalArgumentException(name + " must be a number. Got: " + node.asText());
        }
        return node.asDouble();
    }

    private static Duration durationOf(JsonNode node) {
        if (node.isIntegralNumber()) {
            return Duration.ofSeconds(node.asLong());
        }
        return parseDuration(node.asText());
    }

    /**
     * Parse duration from string (e.g., "500ms", "60s", "5m", "1h"). A bare number means seconds.
     *
     * @throws IllegalArgumentException if the value is not a duration
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration value is empty");
        }
        value = value.trim()
                     .toLowerCase();
        if (value.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
        }
        if (value.endsWith("s")) {
            return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
        }
        if (value.endsWith("m")) {
            return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
        }
        if (value.endsWith("h")) {
            return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
        }
        return Duration.ofSeconds(Long.parseLong(value));
    }
}
