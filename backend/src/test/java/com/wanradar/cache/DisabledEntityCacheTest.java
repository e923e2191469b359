package com.wanradar.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DisabledEntityCacheTest {

    private final DisabledEntityCache cache = new DisabledEntityCache("wanradar:port_stats:site");

    @Test
    void storesNothingAndReportsEverythingMissing() {
        JsonNode record = new ObjectMapper().createObjectNode().put("site_id", "s1");

        assertThat(cache.set("s1", List.of(record))).isFalse();
        assertThat(cache.bulkSet(List.of(record), "site_id", Duration.ofDays(1))).isZero();
        assertThat(cache.get("s1")).isEmpty();
        assertThat(cache.isFresh("s1", Duration.ofHours(1))).isFalse();
        assertThat(cache.getStaleIds(List.of("s1", "s2", "s3"), Duration.ofHours(1), 2)).containsExactly("s1", "s2");
        assertThat(cache.summarize(List.of("s1", "s2"), Duration.ofHours(1))).isEqualTo(new FreshnessSummary(0, 0, 2));
        assertThat(cache.markCollected(Instant.now())).isFalse();
        assertThat(cache.lastCollectedAt()).isEmpty();
        assertThat(cache.appendBatch(List.of(record), "site_id", List.of(), Instant.now(), Duration.ofDays(1))).isEmpty();
        assertThat(cache.saveFetchSession(FetchSession.start("port_stats", Instant.now()), Duration.ofHours(1))).isFalse();
        assertThat(cache.fetchSession()).isEmpty();
        assertThat(cache.isAvailable()).isFalse();
    }
}
