package com.wanradar.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;

/**
 * In-process entity cache on a Caffeine store with per-entry expiry. For single-node deployments and tests;
 * several namespaces can share one store from {@link #newStore(long)}.
 */
public class CaffeineEntityCache extends AbstractEntityCache {

    private final Cache<String, StoredValue> store;

    public CaffeineEntityCache(Cache<String, StoredValue> store, String namespace, String metadataKey,
                               String sessionKey, Duration defaultTtl, ObjectMapper objectMapper, Clock clock) {
        super(namespace, metadataKey, sessionKey, defaultTtl, objectMapper, clock);
        this.store = store;
    }

    public static Cache<String, StoredValue> newStore(long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, StoredValue>() {
                    @Override
                    public long expireAfterCreate(String key, StoredValue value, long currentTime) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
                        return value.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    protected void write(String key, String value, Duration ttl) {
        store.put(key, new StoredValue(value, ttl));
    }

    @Override
    protected String read(String key) {
        StoredValue stored = store.getIfPresent(key);
        return stored != null ? stored.value() : null;
    }

    public record StoredValue(String value, Duration ttl) {

        long ttlNanos() {
            return ttl == null ? Long.MAX_VALUE : ttl.toNanos();
        }
    }
}
