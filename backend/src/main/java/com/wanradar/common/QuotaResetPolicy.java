package com.wanradar.common;

import java.time.Duration;
import java.time.Instant;

/**
 * When an upstream quota window is assumed to reset after a rate-limit hit.
 * Default: the top of the next hour, floored at 60s, plus a 5s buffer.
 */
public final class QuotaResetPolicy {

    private final Duration window;
    private final Duration minimumWait;
    private final Duration buffer;

    public QuotaResetPolicy(Duration window, Duration minimumWait, Duration buffer) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
        this.minimumWait = minimumWait != null ? minimumWait : Duration.ZERO;
        this.buffer = buffer != null ? buffer : Duration.ZERO;
    }

    /**
     * Wait from {@code now} until the quota is expected to be available again.
     * Formula: max(minimumWait, time to next window boundary) + buffer.
     */
    public Duration waitFrom(Instant now) {
        long windowMillis = window.toMillis();
        long intoWindow = Math.floorMod(now.toEpochMilli(), windowMillis);
        Duration untilBoundary = Duration.ofMillis(windowMillis - intoWindow);
        Duration base = untilBoundary.compareTo(minimumWait) < 0 ? minimumWait : untilBoundary;
        return base.plus(buffer);
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Hourly window, 60s floor, 5s buffer.
     */
    public static QuotaResetPolicy topOfHour() {
        return new QuotaResetPolicy(Duration.ofHours(1), Duration.ofSeconds(60), Duration.ofSeconds(5));
    }
}
