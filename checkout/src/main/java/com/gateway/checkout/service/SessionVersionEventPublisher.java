package com.gateway.checkout.service;

import com.gateway.checkout.domain.SessionVersion;
import com.gateway.shared.kafka.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Streams every committed session version to Kafka for downstream consumers
 * (analytics, order pipelines). Publishing is asynchronous; failures are logged by
 * {@link EventPublisher} and never affect the API call.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionVersionEventPublisher implements SessionCommitListener {

    private final EventPublisher eventPublisher;
    private final String topic;

    @Override
    public void onCommitted(SessionVersion version) {
        SessionVersionEvent event = new SessionVersionEvent(version);
        eventPublisher.publish(topic, event, version.getSessionId());
        log.debug("Session version queued for Kafka: topic={}, sessionId={}, version={}",
                topic, version.getSessionId(), version.getVersion());
    }
}
