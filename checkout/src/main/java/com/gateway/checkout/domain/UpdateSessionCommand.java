package com.gateway.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial update: every null field leaves the session's current value untouched.
 */
@Value
@Builder
public class UpdateSessionCommand {
    List<Item> items;
    Buyer buyer;
    FulfillmentDetails fulfillmentDetails;
    List<SelectedFulfillmentOption> selectedFulfillmentOptions;
}
