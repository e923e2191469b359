package com.wanradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "wanradar.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    private CacheBackend backend = CacheBackend.REDIS;

    /** First segment of every cache key. */
    private String keyPrefix = "wanradar";

    /** Store-level expiry; bounds growth only, staleness is computed from entry timestamps. */
    private int entryTtlDays = 31;

    /** Size bound of the in-process store (MEMORY backend). */
    private long memoryMaxEntries = 50_000L;

    public enum CacheBackend {
        REDIS,
        MEMORY,
        DISABLED
    }
}
