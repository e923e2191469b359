package com.wanradar.api.dto;

import com.wanradar.ingestion.job.RefreshSchedulerStatus;
import com.wanradar.ingestion.query.RateLimitSummary;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/status response. {@code lastCollectedAt} is null before the first successful cycle.
 */
public record CollectionStatusResponse(
        RateLimitSummary rateLimit,
        List<RefreshSchedulerStatus> schedulers,
        Instant lastCollectedAt,
        boolean cacheAvailable
) {
}
