package com.gateway.checkout.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gateway.checkout.domain.CheckoutSession;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Body of an outbound webhook. {@code data} carries either the full session or an order summary.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookEvent {

    String type;
    Instant timestamp;
    Data data;

    @Value
    @Builder
    @Jacksonized
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Data {
        String checkoutSessionId;
        String status;
        CheckoutSession session;
        OrderSummary order;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderSummary {
        String id;
        String permalinkUrl;
        String status;
    }
}
