package com.gateway.checkout.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gateway.shared.events.EventTypes;

import java.util.Arrays;

/**
 * Why a session version was written. Each reason maps to the lifecycle event announced for it.
 */
public enum TransitionReason {

    CREATED("created", EventTypes.CHECKOUT_SESSION_CREATED),
    UPDATED("updated", EventTypes.CHECKOUT_SESSION_UPDATED),
    COMPLETED("completed", EventTypes.CHECKOUT_SESSION_COMPLETED),
    CANCELED("canceled", EventTypes.CHECKOUT_SESSION_CANCELLED);

    private final String value;
    private final String eventType;

    TransitionReason(String value, String eventType) {
        this.value = value;
        this.eventType = eventType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getEventType() {
        return eventType;
    }

    public static TransitionReason fromValue(String value) {
        return Arrays.stream(values())
                .filter(reason -> reason.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transition reason: " + value));
    }
}
