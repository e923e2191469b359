package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Org-wide gateway device statistics (status, uptime, model) via page-number pagination on
 * {@code /api/v1/orgs/{org}/stats/devices}.
 */
public class GatewayDeviceStatsSource implements SnapshotSource {

    public static final String CATEGORY = "device_stats";

    private static final List<String> IDENTITY = List.of("mac");

    private final WanApiClient client;
    private final String orgId;
    private final Clock clock;
    private final AtomicReference<FetchProgress> progress = new AtomicReference<>(FetchProgress.none());

    public GatewayDeviceStatsSource(WanApiClient client, String orgId, Clock clock) {
        this.client = client;
        this.orgId = orgId;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public String category() {
        return CATEGORY;
    }

    /** Page-number pagination cannot continue an interrupted fetch; {@code resumeCursor} is ignored. */
    @Override
    public ApiCallResult<List<JsonNode>> fetchSnapshot(String resumeCursor, BatchListener listener) {
        progress.set(FetchProgress.none());
        BatchListener downstream = listener != null ? listener : BatchListener.NONE;
        return client.fetchAllPages(
                "Get gateway device stats",
                "/api/v1/orgs/" + orgId + "/stats/devices",
                Map.of("type", "gateway"),
                (records, page, cursor) -> {
                    Instant now = clock.instant();
                    progress.updateAndGet(p -> p.next(records.size(), null, now));
                    downstream.onBatch(records, page, cursor);
                });
    }

    @Override
    public List<String> recordIdentityFields() {
        return IDENTITY;
    }

    @Override
    public FetchProgress progress() {
        return progress.get();
    }
}
