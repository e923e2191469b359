package com.wanradar.ingestion.query;

import com.wanradar.cache.DisabledEntityCache;
import com.wanradar.common.MutableClock;
import com.wanradar.common.QuotaResetPolicy;
import com.wanradar.common.RateLimitStatus;
import com.wanradar.common.RateLimiter;
import com.wanradar.ingestion.adapter.SiteInventory;
import com.wanradar.ingestion.config.RefreshProperties;
import com.wanradar.ingestion.job.RefreshSchedulerLifecycle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionStatusServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:50:00Z"));
    private final RateLimiter rateLimiter = new RateLimiter(clock, QuotaResetPolicy.topOfHour());
    private final RefreshProperties properties = new RefreshProperties();
    private final CollectionStatusService service = new CollectionStatusService(
            rateLimiter,
            new RefreshSchedulerLifecycle(List.of(), false),
            new DisabledEntityCache("wanradar:port_stats:site"),
            new DisabledEntityCache("wanradar:device_stats:site"),
            new SiteInventory(null, "org-1", List.of("s1", "s2"), Duration.ofMinutes(5)),
            properties);

    @Test
    void clearQuotaReadsOk() {
        RateLimitSummary summary = service.getRateLimitStatus();

        assertThat(summary.rateLimited()).isFalse();
        assertThat(summary.statusText()).isEqualTo("OK");
        assertThat(summary.secondsRemaining()).isNull();
    }

    @Test
    void limitedQuotaShowsCountdown() {
        rateLimiter.setRateLimited();

        RateLimitSummary summary = service.getRateLimitStatus();

        assertThat(summary.rateLimited()).isTrue();
        assertThat(summary.hitCount()).isEqualTo(1);
        assertThat(summary.secondsRemaining()).isEqualTo(605L);
        assertThat(summary.statusText()).isEqualTo("Rate limited, resets in 10m 05s");
    }

    @Test
    void statusTextForZeroRemaining() {
        assertThat(CollectionStatusService.statusText(new RateLimitStatus(true, 3, 0L)))
                .isEqualTo("Rate limited, resets in 0m 00s");
    }

    @Test
    void cacheSummaryCoversKnownSites() {
        properties.getDeviceStats().setMaxAgeSeconds(120);

        assertThat(service.getCacheSummary(TelemetryCategory.PORT_STATS).missing()).isEqualTo(2);
        assertThat(service.maxAge(TelemetryCategory.DEVICE_STATS)).isEqualTo(Duration.ofSeconds(120));
        assertThat(service.isCacheAvailable()).isFalse();
        assertThat(service.getSchedulerStatuses()).isEmpty();
    }

    @Test
    void categoryNames() {
        assertThat(TelemetryCategory.fromPathName("port-stats")).contains(TelemetryCategory.PORT_STATS);
        assertThat(TelemetryCategory.fromPathName("device_stats")).contains(TelemetryCategory.DEVICE_STATS);
        assertThat(TelemetryCategory.fromPathName("wifi")).isEmpty();
    }
}
