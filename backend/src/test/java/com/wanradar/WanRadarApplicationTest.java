package com.wanradar;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wanradar.cache.EntityCache;
import com.wanradar.config.AsyncConfig;
import com.wanradar.ingestion.config.RefreshConfig;
import com.wanradar.ingestion.job.RefreshScheduler;
import com.wanradar.ingestion.job.RefreshSchedulerLifecycle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "wanradar.cache.backend=MEMORY",
        "wanradar.refresh.enabled=false",
        "wanradar.refresh.site-ids=s1,s2"
})
@AutoConfigureWebTestClient
class WanRadarApplicationTest {

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    RefreshSchedulerLifecycle lifecycle;
    @Autowired
    @Qualifier(RefreshConfig.PORT_STATS_CACHE)
    EntityCache portStatsCache;
    @Autowired
    ObjectMapper objectMapper;
    @Autowired
    @Qualifier(AsyncConfig.REFRESH_EXECUTOR)
    Executor refreshExecutor;

    @Test
    @DisplayName("both categories get a scheduler; none runs while refresh is disabled")
    void schedulersWiredButIdle() {
        assertThat(lifecycle.getSchedulers()).extracting(RefreshScheduler::category)
                .containsExactly("port_stats", "device_stats");
        assertThat(lifecycle.getSchedulers()).noneMatch(RefreshScheduler::isRunning);
    }

    @Test
    @DisplayName("worker loops run on a bounded pool sized for one thread per category")
    void refreshExecutorIsBoundedPool() {
        assertThat(refreshExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) refreshExecutor;
        assertThat(pool.getMaxPoolSize()).isEqualTo(2);
        assertThat(pool.getQueueCapacity()).isZero();
        assertThat(pool.getThreadNamePrefix()).isEqualTo("refresh-");
        assertThat(pool.getActiveCount()).isZero();
    }

    @Test
    @DisplayName("cached site data is served and counted against the configured sites")
    void servesCachedData() {
        portStatsCache.set("s1", List.of(objectMapper.createObjectNode().put("site_id", "s1").put("port_id", "ge-0/0/0")));

        webTestClient.get().uri("/api/v1/sites/s1/port-stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.records[0].port_id").isEqualTo("ge-0/0/0");

        webTestClient.get().uri("/api/v1/status/cache?category=port-stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.fresh").isEqualTo(1)
                .jsonPath("$.missing").isEqualTo(1)
                .jsonPath("$.total").isEqualTo(2);

        webTestClient.get().uri("/api/v1/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rateLimit.rateLimited").isEqualTo(false)
                .jsonPath("$.schedulers.length()").isEqualTo(2);
    }
}
