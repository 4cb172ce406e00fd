package com.gateway.shared.webhook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LinearBackoffRetryPolicyTest {

    @Test
    @DisplayName("computeDelayMs — attempt times base delay")
    void linearGrowth() {
        RetryPolicy policy = new LinearBackoffRetryPolicy(1000);

        assertThat(policy.computeDelayMs(1)).isEqualTo(1000);
        assertThat(policy.computeDelayMs(2)).isEqualTo(2000);
        assertThat(policy.computeDelayMs(0)).isZero();
    }

    @Test
    @DisplayName("constructor — negative base delay is refused")
    void negativeBase() {
        assertThatThrownBy(() -> new LinearBackoffRetryPolicy(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
