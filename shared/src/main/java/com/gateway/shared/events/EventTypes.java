package com.gateway.shared.events;

/**
 * Canonical event type constants.
 * Webhook subscribers and Kafka consumers match on these strings, so renaming one
 * is a breaking change for them.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Checkout Session Domain ───────────────────────────────────────────────
    public static final String CHECKOUT_SESSION_CREATED   = "checkout.session.created";
    public static final String CHECKOUT_SESSION_UPDATED   = "checkout.session.updated";
    public static final String CHECKOUT_SESSION_COMPLETED = "checkout.session.completed";
    public static final String CHECKOUT_SESSION_CANCELLED = "checkout.session.cancelled";

    // ── Order Domain ──────────────────────────────────────────────────────────
    public static final String ORDER_CREATED = "order.created";

    // ── Kafka Topics ──────────────────────────────────────────────────────────
    public static final String TOPIC_SESSION_VERSIONS = "checkout.sessions.versions";
}
