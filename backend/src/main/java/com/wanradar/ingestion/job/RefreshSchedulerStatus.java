package com.wanradar.ingestion.job;

import com.wanradar.common.RateLimitStatus;
import com.wanradar.ingestion.adapter.FetchProgress;

import java.time.Instant;

public record RefreshSchedulerStatus(
        String category,
        boolean running,
        RefreshState state,
        RefreshMode mode,
        long cyclesRun,
        long totalEntitiesRefreshed,
        boolean initialCoverageComplete,
        boolean rateLimited,
        RateLimitStatus rateLimitStatus,
        FetchProgress progress,
        Instant lastCycleCompletedAt
) {
}
