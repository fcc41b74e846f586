package com.lolanalyzer.riot.infra;

import java.time.Duration;
import java.util.function.Supplier;

public interface RateLimiter {

    void waitForPermission() throws InterruptedException;

    boolean waitForPermission(Duration timeout) throws InterruptedException;

    void reportThrottled(Duration retryAfter);

    default <T> T execute(Supplier<T> task) throws InterruptedException {
        waitForPermission();
        return task.get();
    }
}
