package com.gateway.checkout.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every error the checkout API reports to clients.
 * Carries the wire-level type and code plus the HTTP status to answer with.
 */
@Getter
public abstract class CheckoutException extends RuntimeException {

    private final ErrorType type;
    private final String code;
    private final HttpStatus status;

    protected CheckoutException(ErrorType type, String code, HttpStatus status, String message) {
        super(message);
        this.type = type;
        this.code = code;
        this.status = status;
    }

    protected CheckoutException(ErrorType type, String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.code = code;
        this.status = status;
    }
}
