package com.gateway.checkout.config;

import com.gateway.checkout.merchant.HttpMerchantService;
import com.gateway.checkout.merchant.MerchantService;
import com.gateway.checkout.merchant.StubMerchantService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Merchant capability, chosen by {@code checkout.merchant.mode}: the demo stub or a remote back end.
 */
@Slf4j
@Configuration
public class MerchantConfig {

    static final String MERCHANT_BREAKER = "merchant";

    @Bean
    @ConditionalOnProperty(prefix = "checkout.merchant", name = "mode", havingValue = "stub", matchIfMissing = true)
    public MerchantService stubMerchantService(Clock clock, CheckoutProperties properties) {
        log.info("Merchant service: stub");
        return new StubMerchantService(clock, properties.getMerchant().getPermalinkBase());
    }

    @Configuration
    @ConditionalOnProperty(prefix = "checkout.merchant", name = "mode", havingValue = "http")
    static class HttpMerchant {

        @Bean
        public CircuitBreakerRegistry circuitBreakerRegistry() {
            CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                    .slidingWindowSize(20)
                    .minimumNumberOfCalls(10)
                    .failureRateThreshold(50)
                    .waitDurationInOpenState(Duration.ofSeconds(30))
                    .build();
            return CircuitBreakerRegistry.of(config);
        }

        @Bean
        public MerchantService httpMerchantService(RestClient.Builder restClientBuilder,
                                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                                   CheckoutProperties properties) {
            CheckoutProperties.Merchant merchant = properties.getMerchant();
            if (merchant.getBaseUrl() == null || merchant.getBaseUrl().isBlank()) {
                throw new IllegalStateException("checkout.merchant.base-url is required when checkout.merchant.mode=http");
            }

            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(merchant.getConnectTimeout());
            requestFactory.setReadTimeout(merchant.getReadTimeout());

            RestClient restClient = restClientBuilder
                    .baseUrl(merchant.getBaseUrl())
                    .requestFactory(requestFactory)
                    .build();
            CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(MERCHANT_BREAKER);
            log.info("Merchant service: http, baseUrl={}", merchant.getBaseUrl());
            return new HttpMerchantService(restClient, breaker);
        }
    }
}
