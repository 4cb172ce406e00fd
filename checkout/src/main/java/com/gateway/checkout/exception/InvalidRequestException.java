package com.gateway.checkout.exception;

import org.springframework.http.HttpStatus;

/**
 * The request is well-formed but not acceptable in the session's current state.
 */
public class InvalidRequestException extends CheckoutException {

    public static final String MISSING_PAYMENT_DATA = "missing_payment_data";
    public static final String ALREADY_COMPLETED = "already_completed";
    public static final String CANCELLATION_NOT_ALLOWED = "cancellation_not_allowed";

    public InvalidRequestException(String code, String message) {
        super(ErrorType.INVALID_REQUEST, code, HttpStatus.BAD_REQUEST, message);
    }

    public static InvalidRequestException missingPaymentData() {
        return new InvalidRequestException(MISSING_PAYMENT_DATA,
                "payment_data is required to complete checkout session");
    }

    public static InvalidRequestException notCompletable(String sessionId) {
        return new InvalidRequestException(ALREADY_COMPLETED,
                "Checkout session " + sessionId + " cannot be completed");
    }

    public static InvalidRequestException cancellationNotAllowed(String sessionId) {
        return new InvalidRequestException(CANCELLATION_NOT_ALLOWED,
                "Checkout session " + sessionId + " cannot be canceled in its current state");
    }
}
