package com.wanradar.ingestion.query;

/**
 * Quota state for status surfaces. {@code secondsRemaining} is null when not limited.
 */
public record RateLimitSummary(boolean rateLimited, String statusText, int hitCount, Long secondsRemaining) {
}
