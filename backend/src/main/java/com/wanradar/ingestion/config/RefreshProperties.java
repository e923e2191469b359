package com.wanradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Background refresh schedulers: one per telemetry category. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "wanradar.refresh")
@NoArgsConstructor
@Getter
@Setter
public class RefreshProperties {

    /** When false no scheduler is started and upstream credentials are not required. */
    private boolean enabled = false;

    /** Static known-site set; when empty the org site list is used. */
    private List<String> siteIds = new ArrayList<>();

    private int siteInventoryTtlMinutes = 60;

    /** Sleep granularity; stop() is observed within this interval. */
    private long pollIntervalMs = 1000L;

    private int maxRateLimitWaitSeconds = 60;

    private int errorBackoffSeconds = 5;

    private int stopTimeoutSeconds = 5;

    /** A fetch interrupted longer ago than this starts over instead of continuing from its last cursor. */
    private int resumeMaxAgeSeconds = 3600;

    /** After initial coverage, log a status line every N cycles. */
    private int heartbeatEveryCycles = 10;

    private CategoryProperties portStats = new CategoryProperties(300, 3600);

    private CategoryProperties deviceStats = new CategoryProperties(300, 3600);

    @NoArgsConstructor
    @Getter
    @Setter
    public static class CategoryProperties {

        private boolean enabled = true;

        /** Minimum spacing between cycle starts. */
        private int minDelaySeconds = 300;

        /** Entries older than this count as stale. */
        private int maxAgeSeconds = 3600;

        /** Record field holding the entity (site) id. */
        private String keyField = "site_id";

        public CategoryProperties(int minDelaySeconds, int maxAgeSeconds) {
            this.minDelaySeconds = minDelaySeconds;
            this.maxAgeSeconds = maxAgeSeconds;
        }
    }
}
