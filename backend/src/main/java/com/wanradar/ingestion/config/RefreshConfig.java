package com.wanradar.ingestion.config;

import com.wanradar.cache.EntityCache;
import com.wanradar.common.RateLimiter;
import com.wanradar.config.AsyncConfig;
import com.wanradar.config.EntityCacheFactory;
import com.wanradar.ingestion.adapter.GatewayDeviceStatsSource;
import com.wanradar.ingestion.adapter.GatewayPortStatsSource;
import com.wanradar.ingestion.adapter.SiteInventory;
import com.wanradar.ingestion.adapter.SnapshotSource;
import com.wanradar.ingestion.job.RefreshListener;
import com.wanradar.ingestion.job.RefreshScheduler;
import com.wanradar.ingestion.job.RefreshSchedulerLifecycle;
import com.wanradar.ingestion.job.RefreshSettings;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Per-category entity caches and one refresh scheduler per enabled category, all sharing the upstream rate limiter,
 * the site inventory and the refresh executor.
 */
@Configuration
public class RefreshConfig {

    public static final String PORT_STATS_CACHE = "portStatsCache";
    public static final String DEVICE_STATS_CACHE = "deviceStatsCache";

    @Bean(name = PORT_STATS_CACHE)
    public EntityCache portStatsCache(EntityCacheFactory factory) {
        return factory.create(GatewayPortStatsSource.CATEGORY);
    }

    @Bean(name = DEVICE_STATS_CACHE)
    public EntityCache deviceStatsCache(EntityCacheFactory factory) {
        return factory.create(GatewayDeviceStatsSource.CATEGORY);
    }

    @Bean
    public RefreshSchedulerLifecycle refreshSchedulerLifecycle(
            RefreshProperties refresh,
            GatewayPortStatsSource portStatsSource,
            GatewayDeviceStatsSource deviceStatsSource,
            @Qualifier(PORT_STATS_CACHE) EntityCache portStatsCache,
            @Qualifier(DEVICE_STATS_CACHE) EntityCache deviceStatsCache,
            RateLimiter rateLimiter,
            SiteInventory siteInventory,
            Clock clock,
            ObjectProvider<RefreshListener> listener,
            EntityCacheFactory cacheFactory,
            @Qualifier(AsyncConfig.REFRESH_EXECUTOR) Executor refreshExecutor
    ) {
        RefreshListener callbacks = listener.getIfAvailable(() -> RefreshListener.NONE);
        List<RefreshScheduler> schedulers = new ArrayList<>();
        if (refresh.getPortStats().isEnabled()) {
            schedulers.add(scheduler(portStatsSource, portStatsCache, refresh.getPortStats(), refresh,
                    rateLimiter, siteInventory, clock, callbacks, cacheFactory.entryTtl(), refreshExecutor));
        }
        if (refresh.getDeviceStats().isEnabled()) {
            schedulers.add(scheduler(deviceStatsSource, deviceStatsCache, refresh.getDeviceStats(), refresh,
                    rateLimiter, siteInventory, clock, callbacks, cacheFactory.entryTtl(), refreshExecutor));
        }
        return new RefreshSchedulerLifecycle(schedulers, refresh.isEnabled());
    }

    static RefreshSettings settingsFor(RefreshProperties.CategoryProperties category, RefreshProperties refresh,
                                       Duration entryTtl) {
        return new RefreshSettings(
                Duration.ofSeconds(category.getMinDelaySeconds()),
                Duration.ofSeconds(category.getMaxAgeSeconds()),
                category.getKeyField(),
                entryTtl,
                Duration.ofMillis(refresh.getPollIntervalMs()),
                Duration.ofSeconds(refresh.getMaxRateLimitWaitSeconds()),
                Duration.ofSeconds(refresh.getErrorBackoffSeconds()),
                Duration.ofSeconds(refresh.getStopTimeoutSeconds()),
                refresh.getHeartbeatEveryCycles(),
                Duration.ofSeconds(refresh.getResumeMaxAgeSeconds()));
    }

    private static RefreshScheduler scheduler(SnapshotSource source, EntityCache cache,
                                              RefreshProperties.CategoryProperties category,
                                              RefreshProperties refresh, RateLimiter rateLimiter,
                                              SiteInventory siteInventory, Clock clock,
                                              RefreshListener listener, Duration entryTtl, Executor executor) {
        return new RefreshScheduler(source, cache, rateLimiter, siteInventory,
                settingsFor(category, refresh, entryTtl), clock, listener, executor);
    }
}
