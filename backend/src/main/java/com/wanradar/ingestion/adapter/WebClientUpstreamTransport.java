package com.wanradar.ingestion.adapter;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upstream transport using WebClient. Sends {@code Authorization: Token <token>} and JSON accept/content headers.
 */
public class WebClientUpstreamTransport implements UpstreamTransport {

    private final WebClient webClient;

    public WebClientUpstreamTransport(WebClient.Builder builder, String baseUrl, String apiToken) {
        this.webClient = builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Token " + apiToken)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Mono<UpstreamResponse> get(String endpoint, Map<String, ?> params) {
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(endpoint);
                    Map<String, Object> values = new LinkedHashMap<>();
                    if (params != null) {
                        params.forEach((name, value) -> {
                            if (value != null) {
                                uriBuilder.queryParam(name, "{" + name + "}");
                                values.put(name, value);
                            }
                        });
                    }
                    // values expand as URI variables so opaque cursors are fully encoded
                    return uriBuilder.build(values);
                })
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new UpstreamResponse(response.statusCode().value(), body)));
    }

    /**
     * Prefixes {@code https://} when the configured host has no scheme.
     */
    public static String toBaseUrl(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        String trimmed = host.strip();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.startsWith("http") ? trimmed : "https://" + trimmed;
    }
}
