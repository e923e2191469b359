package com.wanradar.ingestion.adapter;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of an upstream call. Callers branch on {@link #getStatus()} rather than on exception types,
 * because a rate-limit hit calls for waiting while a transient failure calls for retrying soon.
 */
public final class ApiCallResult<T> {

    public enum Status {
        OK,
        RATE_LIMITED,
        TRANSIENT,
        FATAL
    }

    private final Status status;
    private final T value;
    private final Duration retryAfter;
    private final Throwable cause;

    private ApiCallResult(Status status, T value, Duration retryAfter, Throwable cause) {
        this.status = status;
        this.value = value;
        this.retryAfter = retryAfter;
        this.cause = cause;
    }

    public static <T> ApiCallResult<T> ok(T value) {
        return new ApiCallResult<>(Status.OK, value, null, null);
    }

    public static <T> ApiCallResult<T> rateLimited(Duration retryAfter) {
        return new ApiCallResult<>(Status.RATE_LIMITED, null, retryAfter != null ? retryAfter : Duration.ZERO, null);
    }

    public static <T> ApiCallResult<T> transientFailure(Throwable cause) {
        return new ApiCallResult<>(Status.TRANSIENT, null, null, Objects.requireNonNull(cause, "cause"));
    }

    public static <T> ApiCallResult<T> fatal(Throwable cause) {
        return new ApiCallResult<>(Status.FATAL, null, null, Objects.requireNonNull(cause, "cause"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public T getValue() {
        if (status != Status.OK) {
            throw new IllegalStateException("No value for " + status + " result");
        }
        return value;
    }

    /** Wait reported with a RATE_LIMITED result; null otherwise. */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /** Failure cause of a TRANSIENT or FATAL result; null otherwise. */
    public Throwable getCause() {
        return cause;
    }

    /**
     * Re-types a failed result so it can be propagated from a call returning a different value type.
     */
    @SuppressWarnings("unchecked")
    public <U> ApiCallResult<U> asFailure() {
        if (status == Status.OK) {
            throw new IllegalStateException("OK result is not a failure");
        }
        return (ApiCallResult<U>) this;
    }

    /**
     * Value for OK; otherwise throws {@link RateLimitedException} or {@link UpstreamRequestException}.
     */
    public T orElseThrow() {
        return switch (status) {
            case OK -> value;
            case RATE_LIMITED -> throw new RateLimitedException(retryAfter);
            case TRANSIENT, FATAL -> throw cause instanceof UpstreamRequestException u
                    ? u
                    : new UpstreamRequestException("Upstream request failed", cause, status == Status.FATAL);
        };
    }

    @Override
    public String toString() {
        return switch (status) {
            case OK -> "ApiCallResult[OK]";
            case RATE_LIMITED -> "ApiCallResult[RATE_LIMITED, retryAfter=" + retryAfter + "]";
            default -> "ApiCallResult[" + status + ", cause=" + cause + "]";
        };
    }
}
