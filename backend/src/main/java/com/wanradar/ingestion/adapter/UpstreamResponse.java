package com.wanradar.ingestion.adapter;

/**
 * Raw HTTP response as seen by the client: status code and body text (empty string when no body).
 */
public record UpstreamResponse(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
