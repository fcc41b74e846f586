package com.lolanalyzer.riot.client;

/**
 * Performs a single request/response exchange. Implementations report every HTTP status as an {@link ApiResponse}
 * and only throw for failures below HTTP (connection refused, timeouts...).
 */
public interface Transport {

    ApiResponse send(ApiRequest request);
}
