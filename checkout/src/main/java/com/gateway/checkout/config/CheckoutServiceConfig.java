package com.gateway.checkout.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gateway.shared.webhook.WebhookDispatcher;
import com.gateway.shared.webhook.WebhookProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Checkout Service Spring Configuration
 */
@Configuration
@EnableConfigurationProperties({CheckoutProperties.class, WebhookProperties.class})
public class CheckoutServiceConfig {

    // ─── Jackson ──────────────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ─── Webhooks ─────────────────────────────────────────────────────────────

    @Bean
    public WebhookDispatcher webhookDispatcher(WebhookProperties properties,
                                               RestClient.Builder restClientBuilder,
                                               ObjectMapper objectMapper,
                                               MeterRegistry meterRegistry) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        RestClient restClient = restClientBuilder
                .requestFactory(requestFactory)
                .build();
        return new WebhookDispatcher(properties, restClient, objectMapper, meterRegistry);
    }
}
