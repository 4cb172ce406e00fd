package com.gateway.checkout.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * What the merchant knows about a set of items: priced lines, delivery options and messages.
 * A null list means "not supplied" and leaves the session's current value in place.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MerchantData {
    List<LineItem> lineItems;
    List<FulfillmentOption> fulfillmentOptions;
    List<Message> messages;
}
