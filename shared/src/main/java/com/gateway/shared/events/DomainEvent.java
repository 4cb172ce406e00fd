package com.gateway.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Base CloudEvent following the CloudEvents specification v1.0.
 * https://cloudevents.io/
 *
 * Every event carries:
 *  - id:            Globally unique event identifier (UUID v4)
 *  - type:          Dot-notation name, e.g. "checkout.session.updated"
 *  - source:        Originating service URI, e.g. "/services/checkout-service"
 *  - time:          ISO 8601 timestamp of when the event occurred
 *  - correlationId: Request id of the API call that caused the event
 */
@Getter
@ToString
public abstract class DomainEvent {

    private final String id;
    private final String type;
    private final String source;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    private final String correlationId;
    private final String specversion = "1.0";
    private final String datacontenttype = "application/json";

    protected DomainEvent(String type, String source, Instant time, String correlationId) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.time = time != null ? time : Instant.now();
        this.correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
    }
}
