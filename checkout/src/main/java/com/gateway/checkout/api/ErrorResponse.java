package com.gateway.checkout.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gateway.checkout.exception.ErrorType;
import lombok.Value;

/**
 * Error envelope: {@code {"error": {"type", "code", "message", "param"}}}.
 */
@Value
public class ErrorResponse {

    Body error;

    public static ErrorResponse of(ErrorType type, String code, String message) {
        return new ErrorResponse(new Body(type, code, message, null));
    }

    public static ErrorResponse of(ErrorType type, String code, String message, String param) {
        return new ErrorResponse(new Body(type, code, message, param));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Body {
        ErrorType type;
        String code;
        String message;
        String param;
    }
}
