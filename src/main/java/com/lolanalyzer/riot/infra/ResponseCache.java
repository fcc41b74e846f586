package com.lolanalyzer.riot.infra;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded store for upstream responses.
 * <p>
 * Keys must encode everything that affects the cached value (endpoint, routing, pagination...). The TTL is chosen
 * per call site.
 */
public interface ResponseCache {

    <T> Optional<T> get(String key);

    void set(String key, Object value, Duration ttl);

    void remove(String key);

    void clear();

    /**
     * Drops every entry that has already expired.
     *
     * @return the number of entries removed
     */
    int evictExpired();

    int size();
}
