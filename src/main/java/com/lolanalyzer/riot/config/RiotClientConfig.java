package com.lolanalyzer.riot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lolanalyzer.riot.client.RequestDispatcher;
import com.lolanalyzer.riot.client.RestClientTransport;
import com.lolanalyzer.riot.infra.InMemoryResponseCache;
import com.lolanalyzer.riot.infra.RateLimiter;
import com.lolanalyzer.riot.infra.ResponseCache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class RiotClientConfig {

    public static final String API_KEY_HEADER = "X-Riot-Token";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseCache responseCache(Clock clock) {
        return new InMemoryResponseCache(clock);
    }

    @Bean("riotDispatcher")
    public RequestDispatcher riotDispatcher(
        RiotApiProperties properties,
        RestClient.Builder restClientBuilder,
        @Qualifier("riotLimiter") RateLimiter riotLimiter,
        ResponseCache responseCache,
        ObjectMapper objectMapper
    ) {
        RestClient restClient = restClientBuilder.clone()
            .requestFactory(requestFactory(properties))
            .defaultHeader(API_KEY_HEADER, properties.apiKey())
            .build();

        return new RequestDispatcher(
            "riot",
            new RestClientTransport(restClient),
            riotLimiter,
            responseCache,
            objectMapper,
            properties.defaultRetryAfter(),
            properties.coalesceInFlight()
        );
    }

    @Bean("dataDragonDispatcher")
    public RequestDispatcher dataDragonDispatcher(
        RiotApiProperties properties,
        RestClient.Builder restClientBuilder,
        @Qualifier("dataDragonLimiter") RateLimiter dataDragonLimiter,
        ResponseCache responseCache,
        ObjectMapper objectMapper
    ) {
        RestClient restClient = restClientBuilder.clone()
            .requestFactory(requestFactory(properties))
            .build();

        return new RequestDispatcher(
            "data-dragon",
            new RestClientTransport(restClient),
            dataDragonLimiter,
            responseCache,
            objectMapper,
            properties.defaultRetryAfter(),
            properties.coalesceInFlight()
        );
    }

    private SimpleClientHttpRequestFactory requestFactory(RiotApiProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.connectTimeout());
        factory.setReadTimeout(properties.readTimeout());
        return factory;
    }
}
