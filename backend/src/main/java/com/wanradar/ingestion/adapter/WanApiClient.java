package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Blocking facade over {@link ReactiveWanApiClient}: the caller's thread waits through pacing,
 * retry backoff and pagination. Must not be called from a reactive (event-loop) thread.
 */
public class WanApiClient {

    private final ReactiveWanApiClient delegate;

    public WanApiClient(ReactiveWanApiClient delegate) {
        this.delegate = delegate;
    }

    public ApiCallResult<JsonNode> execute(String operation, String endpoint, Map<String, ?> params) {
        return delegate.execute(operation, endpoint, params).block();
    }

    public ApiCallResult<List<JsonNode>> fetchAllPages(String operation, String endpoint, Map<String, ?> params) {
        return fetchAllPages(operation, endpoint, params, BatchListener.NONE);
    }

    public ApiCallResult<List<JsonNode>> fetchAllPages(
            String operation, String endpoint, Map<String, ?> params, BatchListener listener) {
        return delegate.fetchAllPages(operation, endpoint, params, listener).block();
    }

    public ApiCallResult<List<JsonNode>> fetchAllWithCursor(String operation, String endpoint, Map<String, ?> params) {
        return fetchAllWithCursor(operation, endpoint, params, BatchListener.NONE);
    }

    public ApiCallResult<List<JsonNode>> fetchAllWithCursor(
            String operation, String endpoint, Map<String, ?> params, BatchListener listener) {
        return fetchAllWithCursor(operation, endpoint, params, null, listener);
    }

    public ApiCallResult<List<JsonNode>> fetchAllWithCursor(
            String operation, String endpoint, Map<String, ?> params, String startCursor, BatchListener listener) {
        return delegate.fetchAllWithCursor(operation, endpoint, params, startCursor, listener).block();
    }

    public ReactiveWanApiClient reactive() {
        return delegate;
    }
}
