package com.gateway.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One immutable entry in a session's history. Never updated or deleted.
 */
@Value
@Builder(toBuilder = true)
public class SessionVersion {
    String sessionId;
    int version;
    TransitionReason reason;
    CheckoutSession snapshot;
    String idempotencyKey;
    String requestId;
    String signature;
    Instant timestamp;

    public SessionStatus getStatus() {
        return snapshot.getStatus();
    }
}
