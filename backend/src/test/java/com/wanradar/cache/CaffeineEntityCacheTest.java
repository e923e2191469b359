package com.wanradar.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.wanradar.common.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineEntityCacheTest {

    private static final Duration TTL = Duration.ofDays(31);
    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private CaffeineEntityCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        cache = new CaffeineEntityCache(CaffeineEntityCache.newStore(1_000), "wanradar:port_stats:site",
                "wanradar:metadata:last_collection", "wanradar:port_stats:fetch_progress:current",
                TTL, objectMapper, clock);
    }

    @Test
    @DisplayName("an entity with no entry is not fresh and has infinite age")
    void missingEntity() {
        assertThat(cache.isFresh("site-x", ONE_HOUR)).isFalse();
        assertThat(cache.get("site-x")).isEmpty();
        assertThat(cache.getAges(List.of("site-x")))
                .containsExactly(new EntityAge("site-x", Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("fresh strictly before max age, stale from max age on")
    void freshnessBoundary() {
        assertThat(cache.set("s1", List.of(record("s1", 1)), TTL)).isTrue();

        clock.advance(ONE_HOUR.minusMillis(1));
        assertThat(cache.isFresh("s1", ONE_HOUR)).isTrue();

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.isFresh("s1", ONE_HOUR)).isFalse();
    }

    @Test
    @DisplayName("get returns the payload and write time")
    void getReturnsEntry() {
        cache.set("s1", List.of(record("s1", 1), record("s1", 2)));

        CacheEntry entry = cache.get("s1").orElseThrow();

        assertThat(entry.entityId()).isEqualTo("s1");
        assertThat(entry.timestamp()).isEqualTo(clock.instant());
        assertThat(entry.payload()).hasSize(2);
        assertThat(entry.payload().get(1).get("n").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("stale ids are ordered oldest first, missing before everything, capped at limit")
    void staleIdsOrderedAndLimited() {
        cache.set("oldest", List.of(record("oldest", 1)));
        clock.advance(Duration.ofMinutes(30));
        cache.set("older", List.of(record("older", 1)));
        clock.advance(Duration.ofMinutes(30));
        cache.set("fresh", List.of(record("fresh", 1)));
        clock.advance(Duration.ofMinutes(45));

        List<String> ids = List.of("fresh", "older", "missing", "oldest");

        assertThat(cache.getStaleIds(ids, ONE_HOUR, 10)).containsExactly("missing", "oldest", "older");
        assertThat(cache.getStaleIds(ids, ONE_HOUR, 2)).containsExactly("missing", "oldest");
        assertThat(cache.getStaleIds(ids, ONE_HOUR, 0)).isEmpty();
        assertThat(cache.getAges(ids)).extracting(EntityAge::entityId)
                .containsExactly("missing", "oldest", "older", "fresh");
    }

    @Test
    @DisplayName("bulkSet over 150 records for 5 sites writes 5 entries and getAll returns all 150")
    void bulkSetGroupsByKeyField() {
        List<JsonNode> records = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            records.add(record("site-" + (i % 5), i));
        }

        int written = cache.bulkSet(records, "site_id", TTL);

        List<String> ids = List.of("site-0", "site-1", "site-2", "site-3", "site-4");
        assertThat(written).isEqualTo(5);
        assertThat(cache.get("site-3").orElseThrow().payload()).hasSize(30);
        assertThat(cache.getAll(ids)).hasSize(150).containsExactlyInAnyOrderElementsOf(records);
    }

    @Test
    @DisplayName("records without the key field are skipped")
    void bulkSetSkipsRecordsWithoutKey() {
        ObjectNode orphan = objectMapper.createObjectNode().put("n", 1);

        int written = cache.bulkSet(List.of(orphan, record("s1", 2)), "site_id", TTL);

        assertThat(written).isEqualTo(1);
        assertThat(cache.getAll(List.of("s1"))).hasSize(1);
    }

    @Test
    @DisplayName("summarize counts fresh, stale and missing")
    void summarize() {
        cache.set("old", List.of(record("old", 1)));
        clock.advance(Duration.ofHours(2));
        cache.set("new", List.of(record("new", 1)));

        FreshnessSummary summary = cache.summarize(List.of("old", "new", "none"), ONE_HOUR);

        assertThat(summary).isEqualTo(new FreshnessSummary(1, 1, 1));
        assertThat(summary.total()).isEqualTo(3);
    }

    @Test
    @DisplayName("namespaces sharing a store stay apart; the collection time is shared")
    void sharedStore() {
        Cache<String, CaffeineEntityCache.StoredValue> store = CaffeineEntityCache.newStore(100);
        CaffeineEntityCache ports = new CaffeineEntityCache(store, "wr:port_stats:site", "wr:metadata:last_collection",
                "wr:port_stats:fetch_progress:current", TTL, objectMapper, clock);
        CaffeineEntityCache devices = new CaffeineEntityCache(store, "wr:device_stats:site", "wr:metadata:last_collection",
                "wr:device_stats:fetch_progress:current", TTL, objectMapper, clock);

        ports.set("s1", List.of(record("s1", 1)));
        ports.markCollected(clock.instant());

        assertThat(devices.get("s1")).isEmpty();
        assertThat(devices.lastCollectedAt()).contains(clock.instant());
        assertThat(store.getIfPresent("wr:port_stats:site:s1")).isNotNull();
    }

    @Test
    @DisplayName("batches of one fetch merge per site on the identity fields")
    void appendBatchMergesWithinSession() {
        Instant sessionStart = clock.instant();

        List<String> first = cache.appendBatch(List.of(port("s1", "ge-0/0/0", 1), port("s2", "ge-0/0/0", 1)),
                "site_id", List.of("mac", "port_id"), sessionStart, TTL);
        clock.advance(Duration.ofSeconds(30));
        List<String> second = cache.appendBatch(List.of(port("s1", "ge-0/0/1", 2), port("s1", "ge-0/0/0", 3)),
                "site_id", List.of("mac", "port_id"), sessionStart, TTL);

        assertThat(first).containsExactly("s1", "s2");
        assertThat(second).containsExactly("s1");
        List<JsonNode> s1 = cache.get("s1").orElseThrow().payload();
        assertThat(s1).hasSize(2);
        assertThat(s1).extracting(r -> r.get("port_id").asText() + "=" + r.get("rx").asInt())
                .containsExactlyInAnyOrder("ge-0/0/0=3", "ge-0/0/1=2");
        assertThat(cache.get("s1").orElseThrow().timestamp()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("an entry written before the session started is replaced, not merged")
    void appendBatchReplacesOlderEntries() {
        cache.set("s1", List.of(port("s1", "ge-0/0/9", 1)));
        clock.advance(Duration.ofMinutes(10));

        cache.appendBatch(List.of(port("s1", "ge-0/0/0", 2)), "site_id", List.of("mac", "port_id"),
                clock.instant(), TTL);

        assertThat(cache.get("s1").orElseThrow().payload()).extracting(r -> r.get("port_id").asText())
                .containsExactly("ge-0/0/0");
    }

    @Test
    @DisplayName("the fetch session survives a write and read through the store")
    void fetchSessionIsStored() {
        FetchSession session = FetchSession.start("port_stats", clock.instant())
                .afterBatch(1000, List.of("s1", "s2"), "cursor+1=", clock.instant().plusSeconds(5));

        assertThat(cache.fetchSession()).isEmpty();
        assertThat(cache.saveFetchSession(session, ONE_HOUR)).isTrue();

        FetchSession stored = cache.fetchSession().orElseThrow();
        assertThat(stored.sessionId()).isEqualTo("port_stats_" + clock.instant().getEpochSecond());
        assertThat(stored.status()).isEqualTo(FetchSession.Status.IN_PROGRESS);
        assertThat(stored.batchesCompleted()).isEqualTo(1);
        assertThat(stored.recordsSaved()).isEqualTo(1000);
        assertThat(stored.entityIds()).containsExactlyInAnyOrder("s1", "s2");
        assertThat(stored.lastCursor()).isEqualTo("cursor+1=");
        assertThat(stored.startedAt()).isEqualTo(clock.instant());
        assertThat(stored.isResumable(clock.instant().plus(Duration.ofMinutes(59)), ONE_HOUR)).isTrue();
        assertThat(stored.isResumable(clock.instant().plus(ONE_HOUR), ONE_HOUR)).isFalse();
        assertThat(stored.finish(FetchSession.Status.COMPLETED, clock.instant()).isResumable(clock.instant(), ONE_HOUR))
                .isFalse();
    }

    private ObjectNode port(String siteId, String portId, int rx) {
        return objectMapper.createObjectNode().put("site_id", siteId).put("mac", "5c5b35000001")
                .put("port_id", portId).put("rx", rx);
    }

    private ObjectNode record(String siteId, int n) {
        return objectMapper.createObjectNode().put("site_id", siteId).put("n", n);
    }
}
