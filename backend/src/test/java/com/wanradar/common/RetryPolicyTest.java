package com.wanradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("delay grows linearly with the attempt number")
    void linearBackoff() {
        RetryPolicy policy = new RetryPolicy(1000L, 3);

        assertThat(policy.delayMs(1)).isEqualTo(1000L);
        assertThat(policy.delayMs(2)).isEqualTo(2000L);
        assertThat(policy.delayMs(3)).isEqualTo(3000L);
    }

    @Test
    @DisplayName("attempt numbers below one use the base delay")
    void attemptZeroUsesBase() {
        assertThat(new RetryPolicy(250L, 2).delayMs(0)).isEqualTo(250L);
    }

    @Test
    void defaultPolicy() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.delayMs(1)).isEqualTo(1000L);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new RetryPolicy(0L, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(10L, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
