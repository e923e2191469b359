package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Called after each page of a paginated fetch succeeds. Exceptions thrown here are logged and do not abort the fetch.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NONE = (records, batchNumber, nextCursor) -> { };

    void onBatch(List<JsonNode> records, int batchNumber, String nextCursor);
}
