package com.purchasingpower.signalintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry configuration for transient provider failures (429, 5xx, connection resets).
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 1
 *     backoff-ms: 250
 *     max-backoff-ms: 1000
 * </pre>
 *
 * <p>Requests come from a live call, so the defaults allow a single quick retry. Auth
 * failures (401/403) are never retried.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Retries after the initial attempt. Zero disables retrying.
     */
    private int maxAttempts = 1;

    private long backoffMs = 250;

    private long maxBackoffMs = 1000;

    /**
     * Reactor retry spec shared by every WebClient-based provider client.
     */
    public Retry toRetrySpec() {
        return Retry.backoff(maxAttempts, Duration.ofMillis(backoffMs))
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .filter(GlobalRetryConfig::isTransient)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable ex) {
        if (ex instanceof WebClientResponseException webEx) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return ex instanceof WebClientRequestException;
    }
}
