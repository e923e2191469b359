package com.wanradar.api.dto;

import org.springframework.http.HttpStatusCode;

import java.time.Instant;

/**
 * Error payload of every non-2xx API response. {@code error} is a stable machine-readable code;
 * {@code message} never carries exception text.
 */
public record ErrorBody(int status, String error, String message, Instant timestamp) {

    public static ErrorBody of(HttpStatusCode status, String error, String message) {
        return new ErrorBody(status.value(), error, message, Instant.now());
    }
}
