package com.gateway.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Request-scoped headers that travel with every session operation.
 * Signature and timestamp are recorded but not verified here.
 */
@Value
@Builder
public class RequestMetadata {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String REQUEST_ID_HEADER = "Request-Id";
    public static final String SIGNATURE_HEADER = "Signature";
    public static final String TIMESTAMP_HEADER = "Timestamp";
    public static final String API_VERSION_HEADER = "API-Version";
    public static final String USER_AGENT_HEADER = "User-Agent";
    public static final String ACCEPT_LANGUAGE_HEADER = "Accept-Language";

    String idempotencyKey;
    String requestId;
    String signature;
    String timestamp;
    String apiVersion;
    String userAgent;
    String acceptLanguage;

    public static RequestMetadata of(String idempotencyKey, String requestId) {
        return RequestMetadata.builder()
                .idempotencyKey(idempotencyKey)
                .requestId(requestId)
                .build();
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}
