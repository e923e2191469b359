package com.wanradar.ingestion.adapter;

import java.time.Instant;

/**
 * Progress of the snapshot fetch in flight (or the last one): batches and records received so far,
 * and the continuation cursor handed out with the latest batch.
 */
public record FetchProgress(int batches, int records, String cursor, Instant updatedAt) {

    public static FetchProgress none() {
        return new FetchProgress(0, 0, null, null);
    }

    FetchProgress next(int batchRecords, String nextCursor, Instant at) {
        return new FetchProgress(batches + 1, records + batchRecords, nextCursor, at);
    }
}
