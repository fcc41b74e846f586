package com.lolanalyzer.riot.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class InMemoryResponseCache implements ResponseCache {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResponseCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public <T> Optional<T> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            // conditional remove keeps a fresher value written concurrently
            entries.remove(key, entry);
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of((T) entry.value());
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        entries.put(key, new CacheEntry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        entries.forEach((key, entry) -> {
            if (entry.isExpiredAt(now) && entries.remove(key, entry)) {
                removed.incrementAndGet();
            }
        });
        if (removed.get() > 0) {
            log.debug("Evicted {} expired cache entries", removed.get());
        }
        return removed.get();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private record CacheEntry(Object value, Instant expiresAt) {

        boolean isExpiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
