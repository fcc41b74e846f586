package com.lolanalyzer.riot.client;

import org.springframework.http.HttpMethod;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * One upstream exchange. Immutable, so a throttled request can be re-issued exactly as it was first sent.
 */
public record ApiRequest(HttpMethod method, URI uri, Map<String, String> headers) {

    public ApiRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ApiRequest get(URI uri) {
        return new ApiRequest(HttpMethod.GET, uri, Map.of());
    }
}
