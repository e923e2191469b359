package com.wanradar.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimum spacing between consecutive requests of one client.
 * Callers reserve a slot and then wait the returned delay, blocking or not.
 */
public class RequestPacer {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(Long.MIN_VALUE);

    public RequestPacer(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be zero or positive");
        }
        this.minIntervalNanos = minInterval.toNanos();
    }

    /**
     * Reserves the next request slot. Returns how long the caller must wait before sending (zero when free now).
     */
    public Duration reserve() {
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            long start = (next == Long.MIN_VALUE || now - next >= 0) ? now : next;
            if (nextFreeAtNanos.compareAndSet(next, start + minIntervalNanos)) {
                return Duration.ofNanos(start - now);
            }
        }
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
