package com.gateway.checkout.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Top-level error categories of the checkout API.
 */
public enum ErrorType {

    INVALID_REQUEST("invalid_request"),
    PROCESSING_ERROR("processing_error"),
    RESOURCE_NOT_FOUND("resource_not_found"),
    INTERNAL_ERROR("internal_error");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
