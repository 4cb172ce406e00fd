package com.gateway.checkout.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A delivery method offered by the merchant. {@code type} is {@code shipping} or {@code digital};
 * carrier and delivery window only apply to shipping.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FulfillmentOption {
    String type;
    String id;
    String title;
    String subtitle;
    String carrier;
    Instant earliestDeliveryTime;
    Instant latestDeliveryTime;
    long subtotal;
    long tax;
    long total;
}
