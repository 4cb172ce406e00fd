package com.gateway.shared.webhook;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Outbound webhook settings. Delivery is enabled only when a subscriber URL is configured.
 */
@Data
@ConfigurationProperties(prefix = "checkout.webhook")
public class WebhookProperties {

    private String url;
    private String secret = "local-dev-secret";
    private String merchantName = "LocalMerchant";
    private int maxAttempts = 3;
    private Duration retryDelay = Duration.ofSeconds(1);
    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration readTimeout = Duration.ofSeconds(5);
    private int workerThreads = 2;

    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }
}
