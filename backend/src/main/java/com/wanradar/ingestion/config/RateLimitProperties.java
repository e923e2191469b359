package com.wanradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream quota reset policy: wait until the next window boundary, at least {@code minimumWaitSeconds},
 * plus {@code bufferSeconds}.
 */
@ConfigurationProperties(prefix = "wanradar.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    private int windowMinutes = 60;

    private int minimumWaitSeconds = 60;

    private int bufferSeconds = 5;
}
