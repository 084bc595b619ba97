package org.pragmatica.pulse.alert;

import org.pragmatica.pulse.config.AlertConfig.WebhookConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards alerts to external webhook endpoints.
 *
 * <p>Supports:
 * <ul>
 *   <li>Multiple webhook URLs</li>
 *   <li>Configurable retries</li>
 *   <li>Configurable timeout</li>
 * </ul>
 *
 * <p>Runs on the subscription's delivery thread, so blocking sends never reach the ingestion path.
 */
public final class WebhookAlertSubscriber implements AlertSubscriber {
    private static final Logger log = LoggerFactory.getLogger(WebhookAlertSubscriber.class);

    private final WebhookConfig config;
    private final HttpClient httpClient;

    private WebhookAlertSubscriber(WebhookConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                                    .connectTimeout(Duration.ofMillis(config.timeoutMs()))
                                    .build();
        log.info("Webhook forwarding initialized with {} URLs",
                 config.urls()
                       .size());
    }

    public static WebhookAlertSubscriber webhookAlertSubscriber(WebhookConfig config) {
        return new WebhookAlertSubscriber(config);
    }

    @Override
    public void onAlert(AlertEvent event) {
        var payload = AlertJson.toJson(event);
        log.debug("Forwarding alert {} to {} webhooks",
                  event.sequence(),
                  config.urls()
                        .size());
        for (var url : config.urls()) {
            if (!sendWithRetry(url, payload)) {
                log.error("Failed to send alert {} to webhook {} after {} attempts",
                          event.sequence(),
                          url,
                          config.retryCount() + 1);
            }
        }
    }

    private boolean sendWithRetry(String url, String payload) {
        for (int attempt = 0; attempt <= config.retryCount(); attempt++) {
            if (attempt > 0) {
                log.debug("Retrying webhook {} (attempt {}/{})", url, attempt, config.retryCount());
            }
            try{
                var response = httpClient.send(request(url, payload), HttpResponse.BodyHandlers.discarding());
                if (response.statusCode() >= 200 && response.statusCode() < 300) {
                    log.debug("Alert forwarded successfully to {}", url);
                    return true;
                }
                log.warn("Webhook {} returned status {}", url, response.statusCode());
            } catch (IOException e) {
                log.warn("Error sending to webhook {}: {}", url, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread()
                      .interrupt();
                return false;
            }
        }
        return false;
    }

    private HttpRequest request(String url, String payload) {
        return HttpRequest.newBuilder()
                          .uri(URI.create(url))
                          .timeout(Duration.ofMillis(config.timeoutMs()))
                          .header("Content-Type", "application/json")
                          .POST(HttpRequest.BodyPublishers.ofString(payload))
                          .build();
    }
}
