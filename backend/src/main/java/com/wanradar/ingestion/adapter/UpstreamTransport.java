package com.wanradar.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Issues one authenticated GET against the upstream API. Non-2xx statuses are returned, not raised;
 * only transport-level failures (connect, timeout) complete with an error.
 */
public interface UpstreamTransport {

    Mono<UpstreamResponse> get(String endpoint, Map<String, ?> params);
}
