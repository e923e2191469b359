package com.wanradar.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Entity cache in Redis: SET with expiry per entity, MGET for multi-entity reads.
 */
public class RedisEntityCache extends AbstractEntityCache {

    private final StringRedisTemplate redis;

    public RedisEntityCache(StringRedisTemplate redis, String namespace, String metadataKey, String sessionKey,
                            Duration defaultTtl, ObjectMapper objectMapper, Clock clock) {
        super(namespace, metadataKey, sessionKey, defaultTtl, objectMapper, clock);
        this.redis = redis;
    }

    @Override
    protected void write(String key, String value, Duration ttl) {
        if (ttl == null) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    protected String read(String key) {
        return redis.opsForValue().get(key);
    }

    @Override
    protected List<String> readAll(List<String> keys) {
        return redis.opsForValue().multiGet(keys);
    }
}
