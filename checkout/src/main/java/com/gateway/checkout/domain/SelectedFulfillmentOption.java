package com.gateway.checkout.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The buyer's choice for one fulfillment type. Exactly one of {@code shipping} or {@code digital}
 * is set, matching {@code type}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectedFulfillmentOption {

    public static final String SHIPPING = "shipping";
    public static final String DIGITAL = "digital";

    String type;
    FulfillmentSelection shipping;
    FulfillmentSelection digital;

    public static SelectedFulfillmentOption of(String type, String optionId, List<String> itemIds) {
        FulfillmentSelection selection = FulfillmentSelection.builder()
                .optionId(optionId)
                .itemIds(itemIds)
                .build();
        return DIGITAL.equals(type)
                ? SelectedFulfillmentOption.builder().type(type).digital(selection).build()
                : SelectedFulfillmentOption.builder().type(type).shipping(selection).build();
    }

    public String optionId() {
        FulfillmentSelection selection = selection();
        return selection != null ? selection.getOptionId() : null;
    }

    public FulfillmentSelection selection() {
        return shipping != null ? shipping : digital;
    }

    /** Effective type: the declared one, or inferred from which selection is present. */
    public String effectiveType() {
        if (type != null) {
            return type;
        }
        return shipping != null ? SHIPPING : DIGITAL;
    }
}
