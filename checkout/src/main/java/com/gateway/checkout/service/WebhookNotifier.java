package com.gateway.checkout.service;

import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.Order;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.checkout.domain.TransitionReason;
import com.gateway.shared.events.EventTypes;
import com.gateway.shared.webhook.WebhookDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns committed versions into webhook events for the agent.
 *
 *   created   → checkout.session.created
 *   updated   → checkout.session.updated
 *   completed → checkout.session.completed + order.created
 *   canceled  → checkout.session.cancelled
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookNotifier implements SessionCommitListener {

    static final String ORDER_STATUS_CREATED = "created";

    private final WebhookDispatcher dispatcher;
    private final Clock clock;

    @Override
    public void onCommitted(SessionVersion version) {
        CheckoutSession session = version.getSnapshot();
        sendSessionEvent(version.getReason().getEventType(), session);

        if (version.getReason() == TransitionReason.COMPLETED && session.getOrder() != null) {
            sendOrderCreated(session.getId(), session.getOrder());
        }
    }

    private void sendSessionEvent(String eventType, CheckoutSession session) {
        Instant now = clock.instant();
        WebhookEvent event = WebhookEvent.builder()
                .type(eventType)
                .timestamp(now)
                .data(WebhookEvent.Data.builder()
                        .checkoutSessionId(session.getId())
                        .status(session.getStatus().getValue())
                        .session(session)
                        .build())
                .build();
        log.debug("Queueing webhook: eventType={}, sessionId={}", eventType, session.getId());
        dispatcher.dispatch(eventType, now, event);
    }

    private void sendOrderCreated(String sessionId, Order order) {
        Instant now = clock.instant();
        WebhookEvent event = WebhookEvent.builder()
                .type(EventTypes.ORDER_CREATED)
                .timestamp(now)
                .data(WebhookEvent.Data.builder()
                        .checkoutSessionId(sessionId)
                        .status(ORDER_STATUS_CREATED)
                        .order(WebhookEvent.OrderSummary.builder()
                                .id(order.getId())
                                .permalinkUrl(order.getPermalinkUrl())
                                .status(ORDER_STATUS_CREATED)
                                .build())
                        .build())
                .build();
        log.debug("Queueing webhook: eventType={}, sessionId={}, orderId={}", EventTypes.ORDER_CREATED, sessionId, order.getId());
        dispatcher.dispatch(EventTypes.ORDER_CREATED, now, event);
    }
}
