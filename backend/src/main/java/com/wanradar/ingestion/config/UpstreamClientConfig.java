package com.wanradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wanradar.common.QuotaResetPolicy;
import com.wanradar.common.RateLimiter;
import com.wanradar.common.RetryPolicy;
import com.wanradar.ingestion.adapter.GatewayDeviceStatsSource;
import com.wanradar.ingestion.adapter.GatewayPortStatsSource;
import com.wanradar.ingestion.adapter.ReactiveWanApiClient;
import com.wanradar.ingestion.adapter.SiteInventory;
import com.wanradar.ingestion.adapter.UpstreamTransport;
import com.wanradar.ingestion.adapter.WanApiClient;
import com.wanradar.ingestion.adapter.WebClientUpstreamTransport;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Upstream clients: one shared {@link RateLimiter}, one transport, and a separate paced client per consumer
 * (each snapshot source and the site inventory) so that every worker thread serializes only its own requests.
 */
@Configuration
@EnableConfigurationProperties({ UpstreamProperties.class, RateLimitProperties.class, RefreshProperties.class })
@Slf4j
public class UpstreamClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter upstreamRateLimiter(Clock clock, RateLimitProperties properties) {
        QuotaResetPolicy policy = new QuotaResetPolicy(
                Duration.ofMinutes(properties.getWindowMinutes()),
                Duration.ofSeconds(properties.getMinimumWaitSeconds()),
                Duration.ofSeconds(properties.getBufferSeconds()));
        return new RateLimiter(clock, policy);
    }

    @Bean
    public UpstreamTransport upstreamTransport(WebClient.Builder webClientBuilder,
                                               UpstreamProperties upstream,
                                               RefreshProperties refresh) {
        if (refresh.isEnabled()) {
            requireSet(upstream.getApiToken(), "wanradar.upstream.api-token");
            requireSet(upstream.getOrgId(), "wanradar.upstream.org-id");
        }
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, upstream.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(upstream.getResponseTimeoutSeconds()));
        WebClient.Builder builder = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(logRequest());
        String baseUrl = WebClientUpstreamTransport.toBaseUrl(upstream.getHost());
        log.info("Upstream API {} (org {})", baseUrl, upstream.getOrgId());
        return new WebClientUpstreamTransport(builder, baseUrl, upstream.getApiToken());
    }

    @Bean
    public GatewayPortStatsSource gatewayPortStatsSource(UpstreamTransport transport, RateLimiter rateLimiter,
                                                         ObjectMapper objectMapper, UpstreamProperties upstream,
                                                         Clock clock) {
        WanApiClient client = newClient(GatewayPortStatsSource.CATEGORY, transport, rateLimiter, objectMapper, upstream);
        return new GatewayPortStatsSource(client, upstream.getOrgId(), upstream.getStatsDuration(), clock);
    }

    @Bean
    public GatewayDeviceStatsSource gatewayDeviceStatsSource(UpstreamTransport transport, RateLimiter rateLimiter,
                                                             ObjectMapper objectMapper, UpstreamProperties upstream,
                                                             Clock clock) {
        WanApiClient client = newClient(GatewayDeviceStatsSource.CATEGORY, transport, rateLimiter, objectMapper, upstream);
        return new GatewayDeviceStatsSource(client, upstream.getOrgId(), clock);
    }

    @Bean
    public SiteInventory siteInventory(UpstreamTransport transport, RateLimiter rateLimiter, ObjectMapper objectMapper,
                                       UpstreamProperties upstream, RefreshProperties refresh) {
        WanApiClient client = newClient("sites", transport, rateLimiter, objectMapper, upstream);
        return new SiteInventory(client, upstream.getOrgId(), refresh.getSiteIds(),
                Duration.ofMinutes(refresh.getSiteInventoryTtlMinutes()));
    }

    private static WanApiClient newClient(String name, UpstreamTransport transport, RateLimiter rateLimiter,
                                          ObjectMapper objectMapper, UpstreamProperties upstream) {
        RetryPolicy retryPolicy = new RetryPolicy(upstream.getRetryDelayMs(), upstream.getMaxRetries());
        return new WanApiClient(new ReactiveWanApiClient(
                name,
                transport,
                rateLimiter,
                objectMapper,
                upstream.getPageLimit(),
                Duration.ofMillis(upstream.getRequestIntervalMs()),
                retryPolicy));
    }

    /** Debug-level request line; headers are not logged so the token never reaches the log. */
    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            if (log.isDebugEnabled()) {
                log.debug("Upstream {} {} (Authorization: Token ****)", request.method(), request.url());
            }
            return Mono.just(request);
        });
    }

    private static void requireSet(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must be set when wanradar.refresh.enabled=true");
        }
    }
}
