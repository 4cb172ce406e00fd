package com.gateway.checkout.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class SessionNotFoundException extends CheckoutException {

    public static final String CODE = "resource_not_found";

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorType.INVALID_REQUEST, CODE, HttpStatus.NOT_FOUND,
                "Checkout session " + sessionId + " not found");
        this.sessionId = sessionId;
    }
}
