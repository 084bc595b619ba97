package org.pragmatica.pulse.config;

import java.util.List;

/**
 * Configuration for alert dispatching.
 *
 * <p>Example pulse.toml:
 * <pre>
 * [alerts]
 * queue_capacity = 256
 * history_capacity = 1000
 *
 * [alerts.webhook]
 * enabled = true
 * urls = ["https://pagerduty.example.com/webhook", "https://slack.example.com/webhook"]
 * retry_count = 3
 * timeout_ms = 5000
 * </pre>
 *
 * @param queueCapacity   Outbound queue size per subscriber; when full the oldest unread alert is dropped
 * @param historyCapacity Number of transitions retained for the pull feed
 * @param webhook         Webhook configuration
 */
public record AlertConfig(int queueCapacity,
                          int historyCapacity,
                          WebhookConfig webhook) {
    public static final int DEFAULT_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_HISTORY_CAPACITY = 1000;

    private static final AlertConfig DEFAULT = new AlertConfig(DEFAULT_QUEUE_CAPACITY,
                                                               DEFAULT_HISTORY_CAPACITY,
                                                               WebhookConfig.disabled());

    public static AlertConfig defaults() {
        return DEFAULT;
    }

    public static AlertConfig alertConfig(int queueCapacity, int historyCapacity, WebhookConfig webhook) {
        return new AlertConfig(queueCapacity, historyCapacity, webhook);
    }

    /**
     * Create AlertConfig with webhook URLs and default queue sizes.
     */
    /**
     * Configuration for webhook-based alert forwarding.
     *
     * @param enabled    Whether webhooks are enabled
     * @param urls       List of webhook URLs to call
     * @param retryCount Number of retries for failed webhook calls
     * @param timeoutMs  Timeout for webhook calls in milliseconds
     */
    public record WebhookConfig(boolean enabled,
                                List<String> urls,
                                int retryCount,
                                int timeoutMs) {
        public static WebhookConfig disabled() {
            return new WebhookConfig(false, List.of(), 0, 0);
        }

        public static WebhookConfig webhookConfig(boolean enabled,
                                                  List<String> urls,
                                                  int retryCount,
                                                  int timeoutMs) {
            return new WebhookConfig(enabled, List.copyOf(urls), retryCount, timeoutMs);
        }

        void validate(List<String> errors) {
            if (!enabled) {
                return;
            }
            if (urls == null || urls.isEmpty()) {
                errors.add("alerts.webhook.urls cannot be empty when enabled");
            }
            if (retryCount < 0) {
                errors.add("alerts.webhook.retry_count must be >= 0. Got: " + retryCount);
            }
            if (timeoutMs < 100) {
                errors.add("alerts.webhook.timeout_ms must be >= 100. Got: " + timeoutMs);
            }
        }
    }
}
