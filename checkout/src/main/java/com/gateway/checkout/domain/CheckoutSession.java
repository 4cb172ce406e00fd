package com.gateway.checkout.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Immutable snapshot of a checkout session, exactly as stored in one version and returned
 * to the client. {@code order} is present only once the session is completed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutSession {

    String id;
    PaymentProvider paymentProvider;
    SessionStatus status;
    String currency;

    @Builder.Default
    List<LineItem> lineItems = List.of();

    @Builder.Default
    List<Total> totals = List.of();

    Buyer buyer;
    FulfillmentDetails fulfillmentDetails;

    @Builder.Default
    List<FulfillmentOption> fulfillmentOptions = List.of();

    @Builder.Default
    List<SelectedFulfillmentOption> selectedFulfillmentOptions = List.of();

    @Builder.Default
    List<Message> messages = List.of();

    @Builder.Default
    List<Link> links = List.of();

    Order order;
}
