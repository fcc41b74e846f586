package com.lolanalyzer.riot.client;

import org.springframework.http.HttpHeaders;

import java.util.Optional;

public record ApiResponse(int status, HttpHeaders headers, String body) {

    public ApiResponse {
        headers = headers == null ? HttpHeaders.EMPTY : headers;
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.getFirst(name));
    }
}
