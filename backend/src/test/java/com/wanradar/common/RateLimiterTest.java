package com.wanradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:20:00Z"));

    @Test
    @DisplayName("fresh limiter is not limited")
    void freshLimiterIsClear() {
        RateLimiter limiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());

        assertThat(limiter.checkAndClear()).isFalse();
        assertThat(limiter.timeUntilReset()).isEmpty();
        assertThat(limiter.getStatus()).isEqualTo(RateLimitStatus.clear(0));
        assertThat(limiter.getLastHitTime()).isEmpty();
    }

    @Test
    @DisplayName("setRateLimited waits until the top of the hour plus buffer")
    void waitsUntilTopOfHour() {
        RateLimiter limiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());

        Duration wait = limiter.setRateLimited();

        assertThat(wait).isEqualTo(Duration.ofMinutes(40).plusSeconds(5));
        assertThat(limiter.checkAndClear()).isTrue();
        assertThat(limiter.getLastHitTime()).contains(clock.instant());
    }

    @Test
    @DisplayName("wait is never under 60 seconds, even seconds before the hour")
    void waitIsFlooredAtOneMinute() {
        clock.set(Instant.parse("2024-05-01T10:59:50Z"));
        RateLimiter limiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());

        Duration wait = limiter.setRateLimited();

        assertThat(wait).isGreaterThanOrEqualTo(Duration.ofSeconds(60));
        assertThat(wait).isEqualTo(Duration.ofSeconds(65));
    }

    @Test
    @DisplayName("checkAndClear clears once the reset time passes and stays clear")
    void clearsAfterReset() {
        RateLimiter limiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());
        Duration wait = limiter.setRateLimited();

        clock.advance(wait.minusSeconds(1));
        assertThat(limiter.checkAndClear()).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.checkAndClear()).isFalse();
        assertThat(limiter.checkAndClear()).isFalse();
        assertThat(limiter.timeUntilReset()).isEmpty();
        assertThat(limiter.getStatus().limited()).isFalse();
    }

    @Test
    @DisplayName("status reports remaining seconds rounded up and cumulative hit count")
    void statusCountsHits() {
        RateLimiter limiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());
        limiter.setRateLimited();
        clock.advance(Duration.ofMillis(500));

        RateLimitStatus status = limiter.getStatus();
        assertThat(status.limited()).isTrue();
        assertThat(status.hitCount()).isEqualTo(1);
        assertThat(status.secondsRemaining()).isEqualTo(2405L);

        clock.advance(Duration.ofHours(1));
        limiter.checkAndClear();
        limiter.setRateLimited();
        assertThat(limiter.getStatus().hitCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("timeUntilReset shrinks as time passes")
    void timeUntilResetCountsDown() {
        RateLimiter limiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());
        Duration wait = limiter.setRateLimited();

        clock.advance(Duration.ofMinutes(10));

        assertThat(limiter.timeUntilReset()).contains(wait.minusMinutes(10));
    }
}
