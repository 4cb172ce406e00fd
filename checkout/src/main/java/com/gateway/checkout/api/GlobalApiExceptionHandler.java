package com.gateway.checkout.api;

import com.gateway.checkout.exception.CheckoutException;
import com.gateway.checkout.exception.ErrorType;
import com.gateway.checkout.exception.ProcessingException;
import com.gateway.shared.idempotency.IdempotencyIndex.IdempotencyException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure to the checkout error envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    static final String INVALID = "invalid";
    static final String NOT_FOUND = "not_found";

    @ExceptionHandler(CheckoutException.class)
    public ResponseEntity<ErrorResponse> handleCheckoutException(CheckoutException ex, HttpServletRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    request.getRequestURI(), request.getMethod(), requestId(),
                    ex.getType().getValue(), ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    request.getRequestURI(), request.getMethod(), requestId(),
                    ex.getType().getValue(), ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus())
                .body(ErrorResponse.of(ex.getType(), ex.getCode(), ex.getMessage()));
    }

    // Redis or database outage: nothing was committed, the client may retry
    @ExceptionHandler({IdempotencyException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleStoreFailure(RuntimeException ex, HttpServletRequest request) {
        return handleCheckoutException(ProcessingException.storeUnavailable(ex), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String param = fieldError != null ? fieldError.getField() : null;
        String message = fieldError != null
                ? fieldError.getField() + " " + fieldError.getDefaultMessage()
                : "Request validation failed";
        log.warn("HTTP_ERROR path={}, method={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), requestId(),
                ErrorType.INVALID_REQUEST.getValue(), INVALID, message);
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorType.INVALID_REQUEST, INVALID, message, param));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), requestId(),
                ErrorType.INVALID_REQUEST.getValue(), INVALID, truncate(ex.getMessage(), 300));
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorType.INVALID_REQUEST, INVALID, "Request body is missing or malformed"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ErrorResponse.of(ErrorType.INVALID_REQUEST, INVALID, ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoRoute(NoResourceFoundException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ErrorType.RESOURCE_NOT_FOUND, NOT_FOUND,
                        "Route " + request.getMethod() + " " + request.getRequestURI() + " not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, requestId={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), requestId(),
                ex.getClass().getSimpleName(), truncate(ex.getMessage(), 300), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorType.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR.getValue(),
                        "An unexpected error occurred"));
    }

    private static String requestId() {
        String requestId = MDC.get(RequestMetadataFilter.MDC_REQUEST_ID);
        return requestId != null ? requestId : "-";
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
