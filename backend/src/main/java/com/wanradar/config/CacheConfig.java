package com.wanradar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Backing store for entity caches. With the Redis backend an unreachable server fails startup.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
@Slf4j
public class CacheConfig {

    @Bean
    public EntityCacheFactory entityCacheFactory(CacheProperties properties,
                                                 ObjectProvider<StringRedisTemplate> redis,
                                                 ObjectMapper objectMapper,
                                                 Clock clock) {
        StringRedisTemplate template = null;
        if (properties.getBackend() == CacheProperties.CacheBackend.REDIS) {
            template = redis.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("Redis cache backend selected but no Redis connection is configured");
            }
            verifyReachable(template);
        }
        log.info("Entity cache backend: {} (prefix {})", properties.getBackend(), properties.getKeyPrefix());
        return new EntityCacheFactory(properties, template, objectMapper, clock);
    }

    private static void verifyReachable(StringRedisTemplate template) {
        try {
            String pong = template.execute((RedisCallback<String>) RedisConnection::ping);
            log.info("Redis reachable ({})", pong);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Redis cache backend unreachable: " + e.getMessage(), e);
        }
    }
}
