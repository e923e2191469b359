package com.wanradar.common;

/**
 * Point-in-time view of the shared {@link RateLimiter}. {@code secondsRemaining} is null when not limited.
 */
public record RateLimitStatus(boolean limited, int hitCount, Long secondsRemaining) {

    public static RateLimitStatus clear(int hitCount) {
        return new RateLimitStatus(false, hitCount, null);
    }
}
