package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One telemetry category fetched as a full snapshot covering every site in a single paginated query.
 */
public interface SnapshotSource {

    /** Category name, also the cache namespace segment (e.g. {@code port_stats}). */
    String category();

    /**
     * Fetches the snapshot, handing every batch to {@code listener} as it arrives.
     *
     * @param resumeCursor cursor from an interrupted fetch to continue from, or null for a full fetch;
     *                     ignored unless {@link #supportsResume()}
     */
    ApiCallResult<List<JsonNode>> fetchSnapshot(String resumeCursor, BatchListener listener);

    default ApiCallResult<List<JsonNode>> fetchSnapshot() {
        return fetchSnapshot(null, BatchListener.NONE);
    }

    /** Whether a fetch can continue from the cursor handed out with an earlier batch. */
    default boolean supportsResume() {
        return false;
    }

    /**
     * Fields identifying one record within a site's payload. Batches for the same site are merged on them.
     */
    default List<String> recordIdentityFields() {
        return List.of();
    }

    default FetchProgress progress() {
        return FetchProgress.none();
    }
}
