package com.wanradar.ingestion.adapter;

import java.time.Duration;

/**
 * Upstream quota exhausted. Never retried locally; callers wait {@link #getRetryAfter()}.
 */
public class RateLimitedException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("API rate limited, retry after " + (retryAfter != null ? retryAfter.toSeconds() : 0) + "s");
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
