package com.wanradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RequestPacerTest {

    @Test
    @DisplayName("first reservation is free, the next one waits about one interval")
    void secondReservationWaits() {
        RequestPacer pacer = new RequestPacer(Duration.ofMillis(500));

        assertThat(pacer.reserve()).isEqualTo(Duration.ZERO);
        Duration second = pacer.reserve();
        assertThat(second).isGreaterThan(Duration.ofMillis(400)).isLessThanOrEqualTo(Duration.ofMillis(500));
        Duration third = pacer.reserve();
        assertThat(third).isGreaterThan(Duration.ofMillis(900)).isLessThanOrEqualTo(Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("zero interval never waits")
    void zeroIntervalNeverWaits() {
        RequestPacer pacer = new RequestPacer(Duration.ZERO);

        for (int i = 0; i < 5; i++) {
            assertThat(pacer.reserve()).isEqualTo(Duration.ZERO);
        }
        assertThat(pacer.getMinInterval()).isEqualTo(Duration.ZERO);
    }
}
