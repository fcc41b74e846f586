package com.lolanalyzer.riot.client;

import com.lolanalyzer.riot.exception.ApiTransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;

@Slf4j
@RequiredArgsConstructor
public class RestClientTransport implements Transport {

    private final RestClient restClient;

    @Override
    public ApiResponse send(ApiRequest request) {
        log.debug("Sending {} {}", request.method(), request.uri());
        try {
            return restClient.method(request.method())
                .uri(request.uri())
                .headers(headers -> request.headers().forEach(headers::set))
                .exchange((clientRequest, clientResponse) -> {
                    HttpHeaders headers = new HttpHeaders();
                    headers.putAll(clientResponse.getHeaders());
                    String body = StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8);
                    return new ApiResponse(clientResponse.getStatusCode().value(), headers, body);
                });
        } catch (RestClientException e) {
            log.error("Transport failure for {} {}: {}", request.method(), request.uri(), e.getMessage());
            throw new ApiTransportException("Request to " + request.uri() + " failed: " + e.getMessage(), request.uri(), e);
        }
    }
}
