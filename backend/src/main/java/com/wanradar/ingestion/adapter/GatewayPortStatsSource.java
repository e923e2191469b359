package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Org-wide gateway WAN port statistics (rx/tx bytes, speed, up/down) via cursor pagination on
 * {@code /api/v1/orgs/{org}/stats/ports/search}.
 */
public class GatewayPortStatsSource implements SnapshotSource {

    public static final String CATEGORY = "port_stats";

    private static final List<String> IDENTITY = List.of("mac", "port_id");

    private final WanApiClient client;
    private final String orgId;
    private final String duration;
    private final Clock clock;
    private final AtomicReference<FetchProgress> progress = new AtomicReference<>(FetchProgress.none());

    public GatewayPortStatsSource(WanApiClient client, String orgId, String duration, Clock clock) {
        this.client = client;
        this.orgId = orgId;
        this.duration = duration;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public String category() {
        return CATEGORY;
    }

    @Override
    public ApiCallResult<List<JsonNode>> fetchSnapshot(String resumeCursor, BatchListener listener) {
        progress.set(FetchProgress.none());
        BatchListener downstream = listener != null ? listener : BatchListener.NONE;
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("type", "gateway");
        params.put("duration", duration);
        return client.fetchAllWithCursor(
                "Get gateway port stats",
                "/api/v1/orgs/" + orgId + "/stats/ports/search",
                params,
                resumeCursor,
                (records, batchNumber, nextCursor) -> {
                    Instant now = clock.instant();
                    progress.updateAndGet(p -> p.next(records.size(), nextCursor, now));
                    downstream.onBatch(records, batchNumber, nextCursor);
                });
    }

    @Override
    public boolean supportsResume() {
        return true;
    }

    /** One record per gateway port. */
    @Override
    public List<String> recordIdentityFields() {
        return IDENTITY;
    }

    @Override
    public FetchProgress progress() {
        return progress.get();
    }
}
