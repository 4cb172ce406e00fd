package com.gateway.checkout.exception;

import org.springframework.http.HttpStatus;

/**
 * A transient server-side failure. Nothing was committed; the client may retry.
 */
public class ProcessingException extends CheckoutException {

    public static final String CONCURRENT_MODIFICATION = "concurrent_modification";
    public static final String MERCHANT_UNAVAILABLE = "merchant_unavailable";
    public static final String ORDER_CREATION_FAILED = "order_creation_failed";
    public static final String STORE_UNAVAILABLE = "store_unavailable";

    public ProcessingException(String code, HttpStatus status, String message, Throwable cause) {
        super(ErrorType.PROCESSING_ERROR, code, status, message, cause);
    }

    public static ProcessingException concurrentModification(String sessionId, int attempts) {
        return new ProcessingException(CONCURRENT_MODIFICATION, HttpStatus.SERVICE_UNAVAILABLE,
                "Checkout session " + sessionId + " was modified concurrently; gave up after " + attempts + " attempts",
                null);
    }

    public static ProcessingException merchantUnavailable(Throwable cause) {
        return new ProcessingException(MERCHANT_UNAVAILABLE, HttpStatus.BAD_GATEWAY,
                "Merchant data could not be retrieved", cause);
    }

    public static ProcessingException orderCreationFailed(String sessionId, Throwable cause) {
        return new ProcessingException(ORDER_CREATION_FAILED, HttpStatus.BAD_GATEWAY,
                "Order could not be created for checkout session " + sessionId, cause);
    }

    public static ProcessingException storeUnavailable(Throwable cause) {
        return new ProcessingException(STORE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE,
                "Session storage is temporarily unavailable", cause);
    }
}
