package com.wanradar.ingestion.query;

import com.wanradar.cache.CacheEntry;
import com.wanradar.cache.EntityCache;
import com.wanradar.cache.FreshnessSummary;
import com.wanradar.common.RateLimitStatus;
import com.wanradar.common.RateLimiter;
import com.wanradar.ingestion.adapter.SiteInventory;
import com.wanradar.ingestion.config.RefreshConfig;
import com.wanradar.ingestion.config.RefreshProperties;
import com.wanradar.ingestion.job.RefreshScheduler;
import com.wanradar.ingestion.job.RefreshSchedulerLifecycle;
import com.wanradar.ingestion.job.RefreshSchedulerStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only collection status for the API: quota state, scheduler counters and cache freshness.
 */
@Service
public class CollectionStatusService {

    private final RateLimiter rateLimiter;
    private final RefreshSchedulerLifecycle lifecycle;
    private final EntityCache portStatsCache;
    private final EntityCache deviceStatsCache;
    private final SiteInventory siteInventory;
    private final RefreshProperties refreshProperties;

    public CollectionStatusService(
            RateLimiter rateLimiter,
            RefreshSchedulerLifecycle lifecycle,
            @Qualifier(RefreshConfig.PORT_STATS_CACHE) EntityCache portStatsCache,
            @Qualifier(RefreshConfig.DEVICE_STATS_CACHE) EntityCache deviceStatsCache,
            SiteInventory siteInventory,
            RefreshProperties refreshProperties
    ) {
        this.rateLimiter = rateLimiter;
        this.lifecycle = lifecycle;
        this.portStatsCache = portStatsCache;
        this.deviceStatsCache = deviceStatsCache;
        this.siteInventory = siteInventory;
        this.refreshProperties = refreshProperties;
    }

    public RateLimitSummary getRateLimitStatus() {
        RateLimitStatus status = rateLimiter.getStatus();
        return new RateLimitSummary(status.limited(), statusText(status), status.hitCount(), status.secondsRemaining());
    }

    public List<RefreshSchedulerStatus> getSchedulerStatuses() {
        return lifecycle.getSchedulers().stream().map(RefreshScheduler::getStatus).toList();
    }

    /** Most recent successful snapshot write by any scheduler. */
    public Optional<Instant> getLastCollectedAt() {
        return portStatsCache.lastCollectedAt();
    }

    /**
     * Freshness over the site set loaded so far. Runs on the request thread, so the site list is never fetched here.
     */
    public FreshnessSummary getCacheSummary(TelemetryCategory category) {
        return cacheFor(category).summarize(siteInventory.current(), maxAge(category));
    }

    public Optional<CacheEntry> findSiteEntry(TelemetryCategory category, String siteId) {
        return cacheFor(category).get(siteId);
    }

    public boolean isCacheAvailable() {
        return portStatsCache.isAvailable();
    }

    public Duration maxAge(TelemetryCategory category) {
        RefreshProperties.CategoryProperties props = switch (category) {
            case PORT_STATS -> refreshProperties.getPortStats();
            case DEVICE_STATS -> refreshProperties.getDeviceStats();
        };
        return Duration.ofSeconds(props.getMaxAgeSeconds());
    }

    private EntityCache cacheFor(TelemetryCategory category) {
        return switch (category) {
            case PORT_STATS -> portStatsCache;
            case DEVICE_STATS -> deviceStatsCache;
        };
    }

    static String statusText(RateLimitStatus status) {
        if (!status.limited()) {
            return "OK";
        }
        long seconds = status.secondsRemaining() != null ? status.secondsRemaining() : 0L;
        return String.format("Rate limited, resets in %dm %02ds", seconds / 60, seconds % 60);
    }
}
