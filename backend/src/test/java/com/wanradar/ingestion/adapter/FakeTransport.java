package com.wanradar.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Scripted transport: each call consumes the next scripted reply and records the request.
 */
class FakeTransport implements UpstreamTransport {

    record Request(String endpoint, Map<String, Object> params) {
    }

    private final Deque<Supplier<Mono<UpstreamResponse>>> replies = new ArrayDeque<>();
    private final List<Request> requests = new ArrayList<>();

    FakeTransport respond(int status, String body) {
        replies.add(() -> Mono.just(new UpstreamResponse(status, body)));
        return this;
    }

    FakeTransport fail(RuntimeException error) {
        replies.add(() -> Mono.error(error));
        return this;
    }

    FakeTransport reply(Supplier<Mono<UpstreamResponse>> reply) {
        replies.add(reply);
        return this;
    }

    @Override
    public synchronized Mono<UpstreamResponse> get(String endpoint, Map<String, ?> params) {
        requests.add(new Request(endpoint, params == null ? Map.of() : new LinkedHashMap<>(params)));
        Supplier<Mono<UpstreamResponse>> next = replies.poll();
        if (next == null) {
            return Mono.error(new IllegalStateException("no scripted reply for " + endpoint));
        }
        return next.get();
    }

    synchronized List<Request> requests() {
        return List.copyOf(requests);
    }

    int calls() {
        return requests().size();
    }
}
