package com.wanradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream management API connection, pagination and retry settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "wanradar.upstream")
@NoArgsConstructor
@Getter
@Setter
public class UpstreamProperties {

    /** API host; {@code https://} is prepended when no scheme is given. */
    private String host = "api.mist.com";

    private String apiToken = "";

    private String orgId = "";

    /** Records requested per page. Default 1000. */
    private int pageLimit = 1000;

    /** Minimum spacing between requests of one client. Default 100 ms. */
    private long requestIntervalMs = 100L;

    /** Attempts per request for transient failures, including the first. Default 3. */
    private int maxRetries = 3;

    /** Linear backoff unit: attempt n waits n x this. Must be at least 1. */
    private long retryDelayMs = 1000L;

    private int connectTimeoutSeconds = 10;

    private int responseTimeoutSeconds = 60;

    /** Window for stats endpoints that accept a duration. Default 1h. */
    private String statsDuration = "1h";
}
