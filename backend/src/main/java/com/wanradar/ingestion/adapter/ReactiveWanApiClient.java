package com.wanradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wanradar.common.RateLimiter;
import com.wanradar.common.RequestPacer;
import com.wanradar.common.RetryPolicy;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-blocking upstream client: shared quota check, per-client pacing, linear-backoff retry and
 * rate-limit detection, plus page-number and cursor pagination drivers.
 * Pages of one fetch are requested strictly in sequence; all waits are timer-based and never block a thread.
 * {@link WanApiClient} is the blocking facade over the same pipeline.
 */
@Slf4j
public class ReactiveWanApiClient {

    static final String PARAM_PAGE = "page";
    static final String PARAM_LIMIT = "limit";
    static final String PARAM_CURSOR = "search_after";

    private final UpstreamTransport transport;
    private final RateLimiter rateLimiter;
    private final RequestPacer pacer;
    private final RetryPolicy retryPolicy;
    private final Retry retry;
    private final ObjectMapper objectMapper;
    private final int pageLimit;

    public ReactiveWanApiClient(
            String name,
            UpstreamTransport transport,
            RateLimiter rateLimiter,
            ObjectMapper objectMapper,
            int pageLimit,
            Duration requestInterval,
            RetryPolicy retryPolicy
    ) {
        if (pageLimit <= 0) {
            throw new IllegalArgumentException("pageLimit must be positive");
        }
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.pageLimit = pageLimit;
        this.pacer = new RequestPacer(requestInterval != null ? requestInterval : Duration.ZERO);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(this.retryPolicy.getMaxAttempts())
                .intervalFunction(attempt -> this.retryPolicy.delayMs(attempt))
                .retryOnException(ReactiveWanApiClient::isRetryable)
                .build();
        this.retry = Retry.of(name, config);
    }

    /**
     * One logical GET with retries. Never completes with an error: failures are returned as the result status.
     * The shared quota is checked before every attempt, so a limit set by another client during backoff ends the call.
     */
    public Mono<ApiCallResult<JsonNode>> execute(String operation, String endpoint, Map<String, ?> params) {
        return Mono.defer(() -> {
            AtomicInteger attempt = new AtomicInteger();
            return Mono.defer(() -> attemptOnce(operation, endpoint, params, attempt.incrementAndGet()))
                    .transformDeferred(RetryOperator.of(retry))
                    .map(ApiCallResult::ok)
                    .onErrorResume(e -> Mono.just(this.<JsonNode>toFailure(operation, e, attempt.get())));
        });
    }

    /**
     * Page-number pagination: requests page 1, 2, ... until a page holds fewer than {@code pageLimit} records.
     * The response body is expected to be a bare JSON array.
     */
    public Mono<ApiCallResult<List<JsonNode>>> fetchAllPages(
            String operation, String endpoint, Map<String, ?> params, BatchListener listener) {
        return Mono.defer(() -> fetchPage(operation, endpoint, params, 1, new ArrayList<>(),
                listener != null ? listener : BatchListener.NONE));
    }

    /**
     * Cursor pagination: follows {@code next} from {@code {"results": [...], "next": token}} bodies,
     * passing it back as {@code search_after}. Stops when no token is returned or a page is short.
     */
    public Mono<ApiCallResult<List<JsonNode>>> fetchAllWithCursor(
            String operation, String endpoint, Map<String, ?> params, BatchListener listener) {
        return fetchAllWithCursor(operation, endpoint, params, null, listener);
    }

    /**
     * Cursor pagination continuing from {@code startCursor}, a token handed out with an earlier batch.
     * Only records from that point on are returned; batch numbers restart at 1.
     */
    public Mono<ApiCallResult<List<JsonNode>>> fetchAllWithCursor(
            String operation, String endpoint, Map<String, ?> params, String startCursor, BatchListener listener) {
        return Mono.defer(() -> fetchCursorPage(operation, endpoint, params, startCursor, 1, new ArrayList<>(),
                listener != null ? listener : BatchListener.NONE));
    }

    private Mono<ApiCallResult<List<JsonNode>>> fetchPage(
            String operation, String endpoint, Map<String, ?> params, int page,
            List<JsonNode> collected, BatchListener listener) {
        Map<String, Object> pageParams = copyParams(params);
        pageParams.put(PARAM_PAGE, page);
        pageParams.put(PARAM_LIMIT, pageLimit);
        return execute(operation + " (page " + page + ")", endpoint, pageParams)
                .flatMap(result -> {
                    if (!result.isOk()) {
                        return Mono.just(result.<List<JsonNode>>asFailure());
                    }
                    List<JsonNode> batch = elementsOf(result.getValue());
                    collected.addAll(batch);
                    log.debug("{}: {} records from page {}", operation, batch.size(), page);
                    notifyBatch(operation, listener, batch, page, null);
                    if (batch.size() < pageLimit) {
                        log.info("{}: {} records in {} pages", operation, collected.size(), page);
                        return Mono.just(ApiCallResult.ok(collected));
                    }
                    return fetchPage(operation, endpoint, params, page + 1, collected, listener);
                });
    }

    private Mono<ApiCallResult<List<JsonNode>>> fetchCursorPage(
            String operation, String endpoint, Map<String, ?> params, String cursor, int batchNumber,
            List<JsonNode> collected, BatchListener listener) {
        Map<String, Object> pageParams = copyParams(params);
        pageParams.put(PARAM_LIMIT, pageLimit);
        if (cursor != null) {
            pageParams.put(PARAM_CURSOR, cursor);
        }
        return execute(operation + " (batch " + batchNumber + ")", endpoint, pageParams)
                .flatMap(result -> {
                    if (!result.isOk()) {
                        return Mono.just(result.<List<JsonNode>>asFailure());
                    }
                    JsonNode body = result.getValue();
                    List<JsonNode> batch = elementsOf(body);
                    String next = nextCursor(body);
                    collected.addAll(batch);
                    log.debug("{}: {} records in batch {}", operation, batch.size(), batchNumber);
                    notifyBatch(operation, listener, batch, batchNumber, next);
                    if (next == null || batch.size() < pageLimit) {
                        log.info("{}: {} records in {} batches", operation, collected.size(), batchNumber);
                        return Mono.just(ApiCallResult.ok(collected));
                    }
                    return fetchCursorPage(operation, endpoint, params, next, batchNumber + 1, collected, listener);
                });
    }

    private Mono<JsonNode> attemptOnce(String operation, String endpoint, Map<String, ?> params, int attempt) {
        return pace()
                .then(Mono.defer(() -> {
                    if (rateLimiter.checkAndClear()) {
                        Duration remaining = rateLimiter.timeUntilReset().orElse(Duration.ZERO);
                        log.debug("{} skipped: rate limited for another {}s", operation, remaining.toSeconds());
                        return Mono.error(new RateLimitedException(remaining));
                    }
                    return transport.get(endpoint, params);
                }))
                .flatMap(this::parseResponse)
                .doOnError(e -> {
                    if (isRetryable(e)) {
                        log.warn("{} failed (attempt {}/{}): {}", operation, attempt,
                                retryPolicy.getMaxAttempts(), messageOf(e));
                    }
                });
    }

    private Mono<Void> pace() {
        Duration wait = pacer.reserve();
        if (wait.isZero() || wait.isNegative()) {
            return Mono.empty();
        }
        return Mono.delay(wait).then();
    }

    private Mono<JsonNode> parseResponse(UpstreamResponse response) {
        if (isRateLimitResponse(response.status(), response.body())) {
            Duration wait = rateLimiter.setRateLimited();
            log.warn("API rate limit hit (HTTP {}). Pausing upstream calls for {}s", response.status(), wait.toSeconds());
            return Mono.error(new RateLimitedException(wait));
        }
        if (response.status() == 401 || response.status() == 403) {
            return Mono.error(new UpstreamRequestException("HTTP " + response.status() + ": credentials rejected", true));
        }
        if (!response.isSuccess()) {
            return Mono.error(new UpstreamRequestException("HTTP " + response.status(), false));
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Mono.just(objectMapper.nullNode());
        }
        try {
            return Mono.just(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return Mono.error(new UpstreamRequestException("Response body is not valid JSON", e, true));
        }
    }

    private void notifyBatch(String operation, BatchListener listener, List<JsonNode> batch, int batchNumber, String next) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            listener.onBatch(Collections.unmodifiableList(batch), batchNumber, next);
        } catch (Exception e) {
            log.warn("{}: batch callback failed for batch {}: {}", operation, batchNumber, e.getMessage(), e);
        }
    }

    private <T> ApiCallResult<T> toFailure(String operation, Throwable e, int attempts) {
        if (e instanceof RateLimitedException rle) {
            return ApiCallResult.rateLimited(rle.getRetryAfter());
        }
        log.error("{} failed after {} attempts: {}", operation, attempts, messageOf(e));
        if (e instanceof UpstreamRequestException ure && ure.isFatal()) {
            return ApiCallResult.fatal(e);
        }
        return ApiCallResult.transientFailure(e);
    }

    /**
     * Status 429, or a body mentioning "rate limit" / "too many requests" regardless of status.
     */
    static boolean isRateLimitResponse(int status, String body) {
        if (status == 429) {
            return true;
        }
        if (body == null || body.isEmpty()) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit") || lower.contains("too many requests");
    }

    /**
     * Everything but a rate limit is retried; fatal errors only change how an exhausted call is reported.
     */
    static boolean isRetryable(Throwable e) {
        return !(e instanceof RateLimitedException);
    }

    static List<JsonNode> elementsOf(JsonNode body) {
        JsonNode items = body == null ? null : (body.isArray() ? body : body.get("results"));
        if (items == null || !items.isArray()) {
            return new ArrayList<>();
        }
        List<JsonNode> out = new ArrayList<>(items.size());
        items.forEach(out::add);
        return out;
    }

    static String nextCursor(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode next = body.get("next");
        if (next == null || next.isNull()) {
            return null;
        }
        String token = next.asText();
        return token.isBlank() ? null : token;
    }

    private static Map<String, Object> copyParams(Map<String, ?> params) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (params != null) {
            copy.putAll(params);
        }
        return copy;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
