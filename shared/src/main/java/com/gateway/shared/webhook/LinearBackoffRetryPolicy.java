package com.gateway.shared.webhook;

/**
 * Delay grows linearly with the attempt number: {@code baseDelay * attempts}.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {

    private final long baseDelayMs;

    public LinearBackoffRetryPolicy(long baseDelayMs) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        return baseDelayMs * attempts;
    }
}
