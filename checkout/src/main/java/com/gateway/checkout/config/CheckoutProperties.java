package com.gateway.checkout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Checkout service settings under {@code checkout.*}. Webhook settings live in
 * {@link com.gateway.shared.webhook.WebhookProperties}.
 */
@Data
@ConfigurationProperties(prefix = "checkout")
public class CheckoutProperties {

    /** Attempts at appending a version before reporting concurrent modification. */
    private int maxAppendAttempts = 3;

    private Storage storage = new Storage();
    private Merchant merchant = new Merchant();
    private Links links = new Links();
    private Events events = new Events();

    @Data
    public static class Storage {
        /** persistent: PostgreSQL + Redis. memory: process-local maps. */
        private String mode = "persistent";
        private String idempotencyNamespace = "checkout";
        private Duration idempotencyTtl = Duration.ofHours(24);
    }

    @Data
    public static class Merchant {
        /** stub: built-in demo merchant. http: remote merchant back end. */
        private String mode = "stub";
        private String baseUrl;
        private String permalinkBase = "https://merchant.example.com/orders";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Links {
        private String termsOfUse = "";
        private String privacyPolicy = "";
        private String returnPolicy = "";
    }

    @Data
    public static class Events {
        private boolean enabled = false;
        private String topic = "checkout.sessions.versions";
    }
}
