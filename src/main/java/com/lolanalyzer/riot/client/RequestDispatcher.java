package com.lolanalyzer.riot.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lolanalyzer.riot.exception.ApiNotFoundException;
import com.lolanalyzer.riot.exception.ApiThrottledException;
import com.lolanalyzer.riot.exception.ApiTransportException;
import com.lolanalyzer.riot.exception.ApiUnauthorizedException;
import com.lolanalyzer.riot.exception.UnclassifiedApiException;
import com.lolanalyzer.riot.infra.RateLimiter;
import com.lolanalyzer.riot.infra.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Performs one logical upstream call: cache lookup, limiter admission, exchange, classification.
 * <p>
 * A 429 pauses the limiter for the server supplied {@code Retry-After} and the identical request is sent again once
 * the limiter admits it. There is no retry cap and no client side back-off: the server's cool-down is the delay.
 * 404, 401/403 and any other non-2xx status fail the call immediately. Only successful responses are cached.
 */
@Slf4j
public class RequestDispatcher {

    static final Duration MAX_RETRY_AFTER = Duration.ofHours(1);

    private final String name;
    private final Transport transport;
    private final RateLimiter limiter;
    private final ResponseCache cache;
    private final ObjectMapper objectMapper;
    private final Duration defaultRetryAfter;
    private final boolean coalesceInFlight;
    private final RetryTemplate retryTemplate;

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public RequestDispatcher(
        String name,
        Transport transport,
        RateLimiter limiter,
        ResponseCache cache,
        ObjectMapper objectMapper,
        Duration defaultRetryAfter,
        boolean coalesceInFlight
    ) {
        this.name = name;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.defaultRetryAfter = Objects.requireNonNull(defaultRetryAfter, "defaultRetryAfter");
        this.coalesceInFlight = coalesceInFlight;
        this.retryTemplate = RetryTemplate.builder()
            .infiniteRetry()
            .retryOn(ApiThrottledException.class)
            .noBackoff()
            .withListener(new ThrottleRetryListener())
            .build();
    }

    public <T> T call(String cacheKey, ApiRequest request, Class<T> responseType, Duration ttl) {
        return call(cacheKey, request, objectMapper.constructType(responseType), ttl);
    }

    public <T> T call(String cacheKey, ApiRequest request, TypeReference<T> responseType, Duration ttl) {
        return call(cacheKey, request, objectMapper.constructType(responseType), ttl);
    }

    /**
     * Uncached call, for data that changes too quickly to be worth caching.
     */
    public <T> T call(ApiRequest request, Class<T> responseType) {
        return fetch(request, objectMapper.constructType(responseType));
    }

    public <T> T call(ApiRequest request, TypeReference<T> responseType) {
        return fetch(request, objectMapper.constructType(responseType));
    }

    private <T> T call(String cacheKey, ApiRequest request, JavaType responseType, Duration ttl) {
        Objects.requireNonNull(cacheKey, "cacheKey");
        Optional<T> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("[{}] Cache hit for {}", name, cacheKey);
            return cached.get();
        }
        log.debug("[{}] Cache miss for {}", name, cacheKey);

        if (!coalesceInFlight) {
            return fetchAndCache(cacheKey, request, responseType, ttl);
        }

        CompletableFuture<Object> ours = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(cacheKey, ours);
        if (existing != null) {
            log.debug("[{}] Joining in-flight request for {}", name, cacheKey);
            return await(existing);
        }

        try {
            // a previous leader may have populated the cache between our miss and the registration
            T value = cache.<T>get(cacheKey)
                .orElseGet(() -> fetchAndCache(cacheKey, request, responseType, ttl));
            ours.complete(value);
            return value;
        } catch (Throwable t) {
            // followers are parked on the future, they must see every failure
            ours.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(cacheKey, ours);
        }
    }

    private <T> T fetchAndCache(String cacheKey, ApiRequest request, JavaType responseType, Duration ttl) {
        T value = fetch(request, responseType);
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            cache.set(cacheKey, value, ttl);
        }
        return value;
    }

    private <T> T fetch(ApiRequest request, JavaType responseType) {
        ApiResponse response = retryTemplate.execute(context -> exchange(request));
        return decode(request, response, responseType);
    }

    private ApiResponse exchange(ApiRequest request) {
        try {
            limiter.waitForPermission();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiTransportException("Interrupted while waiting for a rate limit permit", request.uri(), e);
        }

        ApiResponse response = transport.send(request);
        if (response.isSuccessful()) {
            return response;
        }

        int status = response.status();
        if (status == 429) {
            Duration retryAfter = retryAfter(response);
            limiter.reportThrottled(retryAfter);
            throw new ApiThrottledException(request.uri(), retryAfter);
        }

        log.error("[{}] Request to {} failed: {} - {}", name, request.uri(), status, response.body());
        throw switch (status) {
            case 404 -> new ApiNotFoundException(request.uri());
            case 401, 403 -> new ApiUnauthorizedException(request.uri(), status);
            default -> new UnclassifiedApiException(request.uri(), status, response.body());
        };
    }

    private Duration retryAfter(ApiResponse response) {
        return response.header(HttpHeaders.RETRY_AFTER)
            .map(String::trim)
            .flatMap(value -> {
                try {
                    long seconds = Long.parseLong(value);
                    if (seconds < 0) {
                        return Optional.empty();
                    }
                    if (seconds > MAX_RETRY_AFTER.toSeconds()) {
                        log.warn("[{}] Capping Retry-After of {}s to {}", name, seconds, MAX_RETRY_AFTER);
                        return Optional.of(MAX_RETRY_AFTER);
                    }
                    return Optional.of(Duration.ofSeconds(seconds));
                } catch (NumberFormatException e) {
                    log.warn("[{}] Ignoring unparsable Retry-After header '{}'", name, value);
                    return Optional.empty();
                }
            })
            .orElse(defaultRetryAfter);
    }

    private <T> T decode(ApiRequest request, ApiResponse response, JavaType responseType) {
        try {
            return objectMapper.readValue(response.body(), responseType);
        } catch (JsonProcessingException e) {
            log.error("[{}] Undecodable response from {}: {}", name, request.uri(), e.getOriginalMessage());
            throw new UnclassifiedApiException(
                "Malformed response body from " + request.uri(), request.uri(), response.status(), response.body(), e);
        }
    }

    private static <T> T await(CompletableFuture<Object> future) {
        try {
            return (T) future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private class ThrottleRetryListener implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            if (throwable instanceof ApiThrottledException throttled) {
                log.warn("[{}] Throttled on {} (attempt {}), retrying after {}s",
                    name, throttled.getUri(), context.getRetryCount(), throttled.getRetryAfter().toSeconds());
            }
        }
    }
}
