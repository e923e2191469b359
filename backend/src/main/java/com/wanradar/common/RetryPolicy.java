package com.wanradar.common;

/**
 * Linear backoff for upstream retries: the wait after failed attempt {@code n} is {@code retryDelay * n}.
 */
public final class RetryPolicy {

    private final long retryDelayMs;
    private final int maxAttempts;

    public RetryPolicy(long retryDelayMs, int maxAttempts) {
        if (retryDelayMs < 1) {
            throw new IllegalArgumentException("retryDelayMs must be at least 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.retryDelayMs = retryDelayMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds after the given one-based failed attempt.
     */
    public long delayMs(int attempt) {
        return retryDelayMs * Math.max(1, attempt);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 3);
    }
}
