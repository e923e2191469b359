package com.wanradar.api.dto;

/**
 * GET /api/v1/status/cache response.
 */
public record CacheSummaryResponse(
        String category,
        long maxAgeSeconds,
        int fresh,
        int stale,
        int missing,
        int total
) {
}
