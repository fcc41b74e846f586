package com.lolanalyzer.riot.exception;

import lombok.Getter;

import java.net.URI;
import java.time.Duration;

/**
 * Upstream answered 429. Handled inside the dispatcher by pausing the limiter and re-issuing the request.
 */
@Getter
public class ApiThrottledException extends RiotApiException {

    private final Duration retryAfter;

    public ApiThrottledException(URI uri, Duration retryAfter) {
        super("Rate limit exceeded, retry after " + retryAfter.toSeconds() + "s", uri, 429);
        this.retryAfter = retryAfter;
    }
}
