package com.wanradar.ingestion.job;

import java.time.Duration;

/**
 * Timing and keying of one refresh scheduler.
 *
 * @param minDelay          minimum spacing between cycle starts
 * @param maxAge            cache age at which an entity counts as stale
 * @param keyField          record field holding the entity id
 * @param entryTtl          backing-store expiry for written entries
 * @param pollInterval      sleep granularity, bounds how long stop() waits on a sleeping worker
 * @param maxRateLimitWait  longest single rate-limited wait before the quota is re-checked
 * @param errorBackoff      pause after a failed cycle
 * @param stopTimeout       bounded join in stop()
 * @param heartbeatEvery    heartbeat log cadence in cycles, after initial coverage
 * @param resumeMaxAge      an interrupted fetch started longer ago than this is not continued
 */
public record RefreshSettings(
        Duration minDelay,
        Duration maxAge,
        String keyField,
        Duration entryTtl,
        Duration pollInterval,
        Duration maxRateLimitWait,
        Duration errorBackoff,
        Duration stopTimeout,
        int heartbeatEvery,
        Duration resumeMaxAge
) {

    public RefreshSettings {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (keyField == null || keyField.isBlank()) {
            throw new IllegalArgumentException("keyField is required");
        }
        heartbeatEvery = Math.max(1, heartbeatEvery);
        if (resumeMaxAge == null) {
            resumeMaxAge = Duration.ofHours(1);
        }
    }
}
