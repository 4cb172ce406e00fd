package com.gateway.checkout.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.checkout.domain.RequestMetadata;
import com.gateway.checkout.exception.ErrorType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Reads the protocol headers once per request, assigns a request id when the client sent none,
 * echoes Idempotency-Key and Request-Id on the response and exposes the request id to logging.
 *
 * Headers longer than the version log can store are rejected here with {@code invalid_request}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RequestMetadataFilter extends OncePerRequestFilter {

    public static final String METADATA_ATTRIBUTE = "checkout.requestMetadata";
    public static final String MDC_REQUEST_ID = "requestId";

    // Column sizes of session_versions
    static final Map<String, Integer> MAX_HEADER_LENGTHS = Map.of(
            RequestMetadata.IDEMPOTENCY_KEY_HEADER, 255,
            RequestMetadata.REQUEST_ID_HEADER, 255,
            RequestMetadata.SIGNATURE_HEADER, 512);

    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        for (Map.Entry<String, Integer> limit : MAX_HEADER_LENGTHS.entrySet()) {
            String value = request.getHeader(limit.getKey());
            if (value != null && value.length() > limit.getValue()) {
                reject(request, response, limit.getKey(), limit.getValue());
                return;
            }
        }

        String requestId = request.getHeader(RequestMetadata.REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        RequestMetadata metadata = RequestMetadata.builder()
                .idempotencyKey(request.getHeader(RequestMetadata.IDEMPOTENCY_KEY_HEADER))
                .requestId(requestId)
                .signature(request.getHeader(RequestMetadata.SIGNATURE_HEADER))
                .timestamp(request.getHeader(RequestMetadata.TIMESTAMP_HEADER))
                .apiVersion(request.getHeader(RequestMetadata.API_VERSION_HEADER))
                .userAgent(request.getHeader(RequestMetadata.USER_AGENT_HEADER))
                .acceptLanguage(request.getHeader(RequestMetadata.ACCEPT_LANGUAGE_HEADER))
                .build();

        request.setAttribute(METADATA_ATTRIBUTE, metadata);
        response.setHeader(RequestMetadata.REQUEST_ID_HEADER, requestId);
        if (metadata.hasIdempotencyKey()) {
            response.setHeader(RequestMetadata.IDEMPOTENCY_KEY_HEADER, metadata.getIdempotencyKey());
        }

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void reject(HttpServletRequest request, HttpServletResponse response,
                        String header, int maxLength) throws IOException {
        String message = header + " must be at most " + maxLength + " characters";
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(),
                ErrorType.INVALID_REQUEST.getValue(), GlobalApiExceptionHandler.INVALID, message);
        response.setStatus(HttpStatus.BAD_REQUEST.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
                ErrorResponse.of(ErrorType.INVALID_REQUEST, GlobalApiExceptionHandler.INVALID, message, header));
    }
}
