package com.gateway.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Command object for creating a checkout session.
 * Decouples the API layer DTO from the domain layer.
 */
@Value
@Builder
public class CreateSessionCommand {
    List<Item> items;
    Buyer buyer;
    FulfillmentDetails fulfillmentDetails;
}
