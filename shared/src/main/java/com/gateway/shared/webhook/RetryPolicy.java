package com.gateway.shared.webhook;

/**
 * Strategy for computing the delay before retrying a failed delivery.
 */
public interface RetryPolicy {

    /**
     * @param attempts the number of attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
