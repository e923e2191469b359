package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * The known site-id set that refresh schedulers measure coverage against.
 * Configured ids win; otherwise the org site list is fetched (page-number pagination) and memoized.
 * When a lookup fails the last known set is served.
 * <p>
 * {@link #get()} may block on the upstream and is for worker threads only. Request handlers read {@link #current()}.
 */
@Slf4j
public class SiteInventory implements Supplier<Set<String>> {

    private static final String KEY = "sites";

    private final WanApiClient client;
    private final String orgId;
    private final Set<String> configuredSiteIds;
    private final Cache<String, Set<String>> memo;
    private final AtomicReference<Set<String>> lastKnown = new AtomicReference<>(Set.of());

    public SiteInventory(WanApiClient client, String orgId, Collection<String> configuredSiteIds, Duration ttl) {
        this.client = client;
        this.orgId = orgId;
        this.configuredSiteIds = configuredSiteIds == null ? Set.of() : Set.copyOf(configuredSiteIds);
        this.memo = Caffeine.newBuilder()
                .expireAfterWrite(ttl != null ? ttl : Duration.ofHours(1))
                .maximumSize(1)
                .build();
    }

    @Override
    public Set<String> get() {
        if (!configuredSiteIds.isEmpty()) {
            return configuredSiteIds;
        }
        Set<String> cached = memo.getIfPresent(KEY);
        if (cached != null) {
            return cached;
        }
        ApiCallResult<List<JsonNode>> result = client.fetchAllPages(
                "Get sites", "/api/v1/orgs/" + orgId + "/sites", Map.of());
        if (!result.isOk()) {
            log.warn("Site list unavailable ({}); serving {} last known sites", result.getStatus(), lastKnown.get().size());
            return lastKnown.get();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode site : result.getValue()) {
            String id = site.path("id").asText("");
            if (!id.isBlank()) {
                ids.add(id);
            }
        }
        Set<String> snapshot = Set.copyOf(ids);
        memo.put(KEY, snapshot);
        lastKnown.set(snapshot);
        log.info("Site inventory loaded: {} sites", snapshot.size());
        return snapshot;
    }

    /**
     * The configured ids, else the memoized or last loaded set. Never calls the upstream; empty until a worker has loaded the list.
     */
    public Set<String> current() {
        if (!configuredSiteIds.isEmpty()) {
            return configuredSiteIds;
        }
        Set<String> cached = memo.getIfPresent(KEY);
        return cached != null ? cached : lastKnown.get();
    }

    public void invalidate() {
        memo.invalidateAll();
    }
}
