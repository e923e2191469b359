package com.wanradar.ingestion.adapter;

/**
 * Thrown when an upstream call fails (transport, HTTP status or unreadable body).
 * Fatal failures (bad credentials, non-JSON body) are retried like any other, but an exhausted call reports FATAL.
 */
public class UpstreamRequestException extends RuntimeException {

    private final boolean fatal;

    public UpstreamRequestException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public UpstreamRequestException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
