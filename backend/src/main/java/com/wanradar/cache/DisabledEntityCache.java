package com.wanradar.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Cache used when caching is switched off: nothing is stored and every entity reads as missing.
 */
public class DisabledEntityCache implements EntityCache {

    private final String namespace;

    public DisabledEntityCache(String namespace) {
        this.namespace = namespace;
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public boolean set(String entityId, List<JsonNode> payload, Duration ttl) {
        return false;
    }

    @Override
    public boolean set(String entityId, List<JsonNode> payload) {
        return false;
    }

    @Override
    public Optional<CacheEntry> get(String entityId) {
        return Optional.empty();
    }

    @Override
    public boolean isFresh(String entityId, Duration maxAge) {
        return false;
    }

    @Override
    public List<EntityAge> getAges(Collection<String> entityIds) {
        return entityIds == null ? List.of() : entityIds.stream().map(EntityAge::missing).toList();
    }

    @Override
    public List<String> getStaleIds(Collection<String> entityIds, Duration maxAge, int limit) {
        if (entityIds == null || limit <= 0) {
            return List.of();
        }
        return entityIds.stream().limit(limit).toList();
    }

    @Override
    public int bulkSet(List<JsonNode> records, String keyField, Duration ttl) {
        return 0;
    }

    @Override
    public List<String> appendBatch(List<JsonNode> records, String keyField, List<String> identityFields,
                                    Instant since, Duration ttl) {
        return List.of();
    }

    @Override
    public List<JsonNode> getAll(Collection<String> entityIds) {
        return List.of();
    }

    @Override
    public FreshnessSummary summarize(Collection<String> entityIds, Duration maxAge) {
        return new FreshnessSummary(0, 0, entityIds == null ? 0 : entityIds.size());
    }

    @Override
    public boolean markCollected(Instant at) {
        return false;
    }

    @Override
    public Optional<Instant> lastCollectedAt() {
        return Optional.empty();
    }

    @Override
    public boolean saveFetchSession(FetchSession session, Duration ttl) {
        return false;
    }

    @Override
    public Optional<FetchSession> fetchSession() {
        return Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
