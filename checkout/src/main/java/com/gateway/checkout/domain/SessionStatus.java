package com.gateway.checkout.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SessionStatus {

    NOT_READY_FOR_PAYMENT("not_ready_for_payment"),
    READY_FOR_PAYMENT("ready_for_payment"),
    COMPLETED("completed"),
    CANCELED("canceled");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Terminal states never change again. */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
    }
}
