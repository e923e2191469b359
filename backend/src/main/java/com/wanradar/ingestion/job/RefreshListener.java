package com.wanradar.ingestion.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Callbacks from a refresh scheduler's worker thread. Exceptions thrown here are logged and do not stop the worker.
 */
public interface RefreshListener {

    RefreshListener NONE = new RefreshListener() {
    };

    /** Called after a snapshot has been written to the cache. */
    default void onDataUpdated(String category, List<JsonNode> records) {
    }

    /** Called once per scheduler, the first time no known entity is missing from the cache. */
    default void onInitialCoverageComplete(String category, int entityCount) {
    }
}
