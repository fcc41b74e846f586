package com.lolanalyzer.riot.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import lombok.Getter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission counter for a single {@link RateWindow}.
 * <p>
 * Tokens refill greedily: {@code floor(elapsed / D * C)} whole tokens become available as time passes and the
 * fractional remainder carries over to the next check. A bucket can be paused, in which case it holds zero tokens
 * until the pause ends and refills from empty, measured from the end of the pause.
 * <p>
 * All state changes happen under the bucket's own lock. Waiters park on a {@link Condition}, so {@link #pause}
 * can get in while someone is waiting and wake them up to re-evaluate.
 */
public class TokenBucket {

    private static final Duration MAX_PAUSE = Duration.ofDays(365);

    @Getter
    private final RateWindow window;

    private final TimeMeter timeMeter;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private Bucket bucket;
    private boolean paused;
    private long pausedUntilNanos;

    public TokenBucket(RateWindow window, TimeMeter timeMeter) {
        this.window = Objects.requireNonNull(window, "window");
        this.timeMeter = Objects.requireNonNull(timeMeter, "timeMeter");
        this.bucket = newBucket(window.capacity(), timeMeter);
    }

    /**
     * Blocks until a token is available and takes it.
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long waitNanos;
            while ((waitNanos = tryConsumeLocked()) > 0) {
                stateChanged.awaitNanos(waitNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a token is available or the deadline passes.
     *
     * @param deadlineNanos deadline on this bucket's {@link TimeMeter}
     * @return {@code true} if a token was taken
     */
    public boolean acquire(long deadlineNanos) throws InterruptedException {
        long lockWait = deadlineNanos - timeMeter.currentTimeNanos();
        if (!lock.tryLock(Math.max(0L, lockWait), TimeUnit.NANOSECONDS)) {
            return false;
        }
        try {
            while (true) {
                long waitNanos = tryConsumeLocked();
                if (waitNanos == 0) {
                    return true;
                }
                long remaining = deadlineNanos - timeMeter.currentTimeNanos();
                if (remaining <= 0) {
                    return false;
                }
                stateChanged.awaitNanos(Math.min(waitNanos, remaining));
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean tryAcquire() {
        lock.lock();
        try {
            return tryConsumeLocked() == 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives back a token taken by an admission that was abandoned half way. Never exceeds capacity.
     * Ignored while paused: the pause already dropped every token.
     */
    public void refund() {
        lock.lock();
        try {
            if (pausedAt(timeMeter.currentTimeNanos())) {
                return;
            }
            bucket.addTokens(1);
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drains the bucket and blocks admission for {@code duration}, capped at a year. An active longer pause is kept.
     */
    public void pause(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        lock.lock();
        try {
            long now = timeMeter.currentTimeNanos();
            long until = now + pauseNanos(duration);
            if (pausedAt(now) && until - pausedUntilNanos <= 0) {
                return;
            }
            paused = true;
            pausedUntilNanos = until;
            // refill of the new bucket is frozen until the pause ends
            bucket = newBucket(0, new PausedTimeMeter(timeMeter, until));
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return pausedAt(timeMeter.currentTimeNanos());
        } finally {
            lock.unlock();
        }
    }

    public long availableTokens() {
        lock.lock();
        try {
            if (pausedAt(timeMeter.currentTimeNanos())) {
                return 0;
            }
            return bucket.getAvailableTokens();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 0 if a token was consumed, otherwise the nanos to wait before trying again
     */
    private long tryConsumeLocked() {
        long now = timeMeter.currentTimeNanos();
        if (pausedAt(now)) {
            return pausedUntilNanos - now;
        }
        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            return 0;
        }
        return Math.max(1L, consumption.getNanosToWaitForRefill());
    }

    private boolean pausedAt(long now) {
        if (paused && now - pausedUntilNanos >= 0) {
            paused = false;
        }
        return paused;
    }

    private Bucket newBucket(long initialTokens, TimeMeter meter) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(window.capacity(), Refill.greedy(window.capacity(), window.duration()))
                .withInitialTokens(initialTokens))
            .withCustomTimePrecision(meter)
            .build();
    }

    private static long pauseNanos(Duration duration) {
        if (duration.isNegative()) {
            return 0L;
        }
        return duration.compareTo(MAX_PAUSE) > 0 ? MAX_PAUSE.toNanos() : duration.toNanos();
    }

    /**
     * Reads as {@code pausedUntil} until that instant has passed, so a bucket built on it starts refilling exactly
     * when the pause ends.
     */
    private record PausedTimeMeter(TimeMeter delegate, long pausedUntilNanos) implements TimeMeter {

        @Override
        public long currentTimeNanos() {
            long now = delegate.currentTimeNanos();
            return now - pausedUntilNanos < 0 ? pausedUntilNanos : now;
        }

        @Override
        public boolean isWallClockBased() {
            return delegate.isWallClockBased();
        }
    }
}
