package com.lolanalyzer.riot.infra;

import io.github.bucket4j.TimeMeter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission gate over several {@link RateWindow}s enforced at once.
 * <p>
 * A caller passes only when every window grants it a token. Buckets are visited shortest window first, under a
 * single fair lock, so admissions are handed out in arrival order and a scarce window cannot be bypassed by
 * interleaving. Tokens taken by an admission that does not complete are refunded.
 */
@Slf4j
public class MultiWindowRateLimiter implements RateLimiter {

    private final List<TokenBucket> buckets;
    private final TimeMeter timeMeter;
    private final ReentrantLock admissionLock = new ReentrantLock(true);

    public MultiWindowRateLimiter(Collection<RateWindow> windows) {
        this(windows, TimeMeter.SYSTEM_NANOTIME);
    }

    public MultiWindowRateLimiter(Collection<RateWindow> windows, TimeMeter timeMeter) {
        if (windows == null || windows.isEmpty()) {
            throw new IllegalArgumentException("At least one rate window is required");
        }
        this.timeMeter = Objects.requireNonNull(timeMeter, "timeMeter");
        this.buckets = windows.stream()
            .sorted(Comparator.comparing(RateWindow::duration))
            .map(window -> new TokenBucket(window, timeMeter))
            .toList();

        log.info("MultiWindowRateLimiter initialized - windows: {}", windows());
    }

    @Override
    public void waitForPermission() throws InterruptedException {
        admissionLock.lockInterruptibly();
        try {
            List<TokenBucket> granted = new ArrayList<>(buckets.size());
            try {
                for (TokenBucket bucket : buckets) {
                    bucket.acquire();
                    granted.add(bucket);
                }
            } catch (InterruptedException e) {
                granted.forEach(TokenBucket::refund);
                throw e;
            }
        } finally {
            admissionLock.unlock();
        }
    }

    @Override
    public boolean waitForPermission(Duration timeout) throws InterruptedException {
        long deadline = timeMeter.currentTimeNanos() + Math.max(0L, timeout.toNanos());
        if (!admissionLock.tryLock(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS)) {
            log.debug("Gave up waiting for the admission lock after {}", timeout);
            return false;
        }
        try {
            List<TokenBucket> granted = new ArrayList<>(buckets.size());
            try {
                for (TokenBucket bucket : buckets) {
                    if (!bucket.acquire(deadline)) {
                        granted.forEach(TokenBucket::refund);
                        log.debug("No permit within {}, window {} still exhausted", timeout, bucket.getWindow());
                        return false;
                    }
                    granted.add(bucket);
                }
                return true;
            } catch (InterruptedException e) {
                granted.forEach(TokenBucket::refund);
                throw e;
            }
        } finally {
            admissionLock.unlock();
        }
    }

    /**
     * Takes a permit only if every window can grant one right now.
     */
    public boolean tryAcquirePermission() {
        if (!admissionLock.tryLock()) {
            return false;
        }
        try {
            List<TokenBucket> granted = new ArrayList<>(buckets.size());
            for (TokenBucket bucket : buckets) {
                if (!bucket.tryAcquire()) {
                    granted.forEach(TokenBucket::refund);
                    return false;
                }
                granted.add(bucket);
            }
            return true;
        } finally {
            admissionLock.unlock();
        }
    }

    /**
     * Pauses every window for the server-mandated cool-down. Runs without the admission lock, since its holder may
     * be parked inside a bucket waiting for this pause to wake it.
     */
    @Override
    public void reportThrottled(Duration retryAfter) {
        log.warn("Upstream throttled, pausing all {} windows for {}", buckets.size(), retryAfter);
        buckets.forEach(bucket -> bucket.pause(retryAfter));
    }

    public long availablePermits() {
        return buckets.stream()
            .mapToLong(TokenBucket::availableTokens)
            .min()
            .orElse(0L);
    }

    public boolean isPaused() {
        return buckets.stream().anyMatch(TokenBucket::isPaused);
    }

    public List<RateWindow> windows() {
        return buckets.stream().map(TokenBucket::getWindow).toList();
    }
}
