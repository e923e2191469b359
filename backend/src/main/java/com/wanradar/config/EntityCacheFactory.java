package com.wanradar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.wanradar.cache.CaffeineEntityCache;
import com.wanradar.cache.DisabledEntityCache;
import com.wanradar.cache.EntityCache;
import com.wanradar.cache.RedisEntityCache;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds per-category entity caches on the backing store chosen by {@code wanradar.cache.backend}.
 * All categories share one store; keys are {@code <prefix>:<category>:site:<siteId>}, plus one fetch-session
 * key per category.
 */
public class EntityCacheFactory {

    private final CacheProperties properties;
    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Cache<String, CaffeineEntityCache.StoredValue> memoryStore;

    public EntityCacheFactory(CacheProperties properties, StringRedisTemplate redis, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.memoryStore = properties.getBackend() == CacheProperties.CacheBackend.MEMORY
                ? CaffeineEntityCache.newStore(properties.getMemoryMaxEntries())
                : null;
    }

    public EntityCache create(String category) {
        String namespace = namespaceFor(category);
        return switch (properties.getBackend()) {
            case REDIS -> new RedisEntityCache(redis, namespace, metadataKey(), sessionKeyFor(category),
                    entryTtl(), objectMapper, clock);
            case MEMORY -> new CaffeineEntityCache(memoryStore, namespace, metadataKey(), sessionKeyFor(category),
                    entryTtl(), objectMapper, clock);
            case DISABLED -> new DisabledEntityCache(namespace);
        };
    }

    public String namespaceFor(String category) {
        return properties.getKeyPrefix() + ":" + category + ":site";
    }

    public String sessionKeyFor(String category) {
        return properties.getKeyPrefix() + ":" + category + ":fetch_progress:current";
    }

    public String metadataKey() {
        return properties.getKeyPrefix() + ":metadata:last_collection";
    }

    public Duration entryTtl() {
        return Duration.ofDays(properties.getEntryTtlDays());
    }
}
