package com.gateway.checkout.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.shared.events.DomainEvent;
import lombok.Getter;

/**
 * Kafka record for one committed session version, keyed by session id.
 */
@Getter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionVersionEvent extends DomainEvent {

    static final String SOURCE = "/services/checkout-service";

    private final String eventType;
    private final String sessionId;
    private final int sessionVersion;
    private final String status;
    private final String idempotencyKey;
    private final String requestId;
    private final CheckoutSession data;

    public SessionVersionEvent(SessionVersion version) {
        super(version.getReason().getEventType(), SOURCE, version.getTimestamp(), version.getRequestId());
        this.eventType = version.getReason().getValue();
        this.sessionId = version.getSessionId();
        this.sessionVersion = version.getVersion();
        this.status = version.getStatus().getValue();
        this.idempotencyKey = version.getIdempotencyKey();
        this.requestId = version.getRequestId();
        this.data = version.getSnapshot();
    }
}
