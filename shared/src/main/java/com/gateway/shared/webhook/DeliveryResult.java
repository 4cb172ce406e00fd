package com.gateway.shared.webhook;

import lombok.Value;

/**
 * Final outcome of one webhook event after all attempts.
 */
@Value
public class DeliveryResult {

    public enum Outcome {
        /** Subscriber answered 2xx. */
        DELIVERED,
        /** Subscriber answered 4xx; not retried. */
        REJECTED,
        /** Every attempt failed with 5xx or an I/O error. */
        EXHAUSTED,
        /** No subscriber configured. */
        SKIPPED
    }

    Outcome outcome;
    int attempts;
    Integer lastStatus;

    public static DeliveryResult skipped() {
        return new DeliveryResult(Outcome.SKIPPED, 0, null);
    }

    public boolean isDelivered() {
        return outcome == Outcome.DELIVERED;
    }
}
