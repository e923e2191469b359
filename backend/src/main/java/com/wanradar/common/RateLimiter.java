package com.wanradar.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-wide upstream quota state. One instance is created at startup and passed to every
 * client and scheduler, so a rate-limit hit seen by any caller pauses all of them.
 * All state is guarded by the instance monitor.
 */
public class RateLimiter {

    private final Clock clock;
    private final QuotaResetPolicy resetPolicy;

    private boolean limited;
    private Instant hitTime;
    private Instant resetTime;
    private int hitCount;

    public RateLimiter(Clock clock, QuotaResetPolicy resetPolicy) {
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.resetPolicy = resetPolicy != null ? resetPolicy : QuotaResetPolicy.topOfHour();
    }

    /**
     * True while the quota is exhausted. Once the reset time has passed the state is cleared and false is returned.
     * Must be called immediately before every upstream request.
     */
    public synchronized boolean checkAndClear() {
        if (!limited) {
            return false;
        }
        Instant now = clock.instant();
        if (!now.isBefore(resetTime)) {
            limited = false;
            hitTime = null;
            resetTime = null;
            return false;
        }
        return true;
    }

    /**
     * Records a rate-limit hit and returns how long callers should wait.
     */
    public synchronized Duration setRateLimited() {
        Instant now = clock.instant();
        Duration wait = resetPolicy.waitFrom(now);
        limited = true;
        hitTime = now;
        resetTime = now.plus(wait);
        hitCount++;
        return wait;
    }

    /**
     * Remaining wait, or empty when not limited.
     */
    public synchronized Optional<Duration> timeUntilReset() {
        if (!limited) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(clock.instant(), resetTime);
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    public synchronized RateLimitStatus getStatus() {
        if (!limited) {
            return RateLimitStatus.clear(hitCount);
        }
        Duration remaining = Duration.between(clock.instant(), resetTime);
        long seconds = Math.max(0L, (remaining.toMillis() + 999) / 1000);
        return new RateLimitStatus(true, hitCount, seconds);
    }

    public synchronized Optional<Instant> getLastHitTime() {
        return Optional.ofNullable(hitTime);
    }
}
