package com.lolanalyzer.riot.infra;

import io.github.bucket4j.TimeMeter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketTest {

    private static final int CAPACITY = 5;
    private static final Duration WINDOW = Duration.ofSeconds(1);

    @Nested
    @DisplayName("Refill with a manual clock")
    class RefillTests {

        private ManualTimeMeter timeMeter;
        private TokenBucket bucket;

        @BeforeEach
        void setUp() {
            timeMeter = new ManualTimeMeter();
            bucket = new TokenBucket(new RateWindow(WINDOW, CAPACITY), timeMeter);
        }

        private void drain() {
            for (int i = 0; i < CAPACITY; i++) {
                bucket.tryAcquire();
            }
        }

        @Test
        @DisplayName("Should grant capacity immediately and reject the next one")
        void shouldGrantCapacityThenReject() {
            for (int i = 0; i < CAPACITY; i++) {
                assertThat(bucket.tryAcquire()).isTrue();
            }

            assertThat(bucket.tryAcquire()).isFalse();
            assertThat(bucket.availableTokens()).isZero();
        }

        @Test
        @DisplayName("Should add one token per refill unit (D / C)")
        void shouldRefillOneTokenPerUnit() {
            drain();

            timeMeter.advance(Duration.ofMillis(199));
            assertThat(bucket.tryAcquire()).isFalse();

            timeMeter.advance(Duration.ofMillis(1));
            assertThat(bucket.tryAcquire()).isTrue();
            assertThat(bucket.tryAcquire()).isFalse();
        }

        @Test
        @DisplayName("Should keep fractional progress between checks")
        void shouldPreserveFractionalProgress() {
            drain();

            timeMeter.advance(Duration.ofMillis(120));
            assertThat(bucket.tryAcquire()).isFalse();

            timeMeter.advance(Duration.ofMillis(80));
            assertThat(bucket.tryAcquire()).isTrue();
        }

        @Test
        @DisplayName("Should be full again after a whole window and never exceed capacity")
        void shouldCapAtCapacity() {
            drain();

            timeMeter.advance(WINDOW);
            assertThat(bucket.availableTokens()).isEqualTo(CAPACITY);

            timeMeter.advance(Duration.ofMinutes(10));
            assertThat(bucket.availableTokens()).isEqualTo(CAPACITY);
        }

        @Test
        @DisplayName("Refund should give a token back but never exceed capacity")
        void shouldRefund() {
            bucket.tryAcquire();
            bucket.refund();
            assertThat(bucket.availableTokens()).isEqualTo(CAPACITY);

            bucket.refund();
            assertThat(bucket.availableTokens()).isEqualTo(CAPACITY);
        }
    }

    @Nested
    @DisplayName("Pause")
    class PauseTests {

        private ManualTimeMeter timeMeter;
        private TokenBucket bucket;

        @BeforeEach
        void setUp() {
            timeMeter = new ManualTimeMeter();
            bucket = new TokenBucket(new RateWindow(WINDOW, CAPACITY), timeMeter);
        }

        @Test
        @DisplayName("Should hold zero tokens for the whole pause, regardless of elapsed time")
        void shouldHoldZeroWhilePaused() {
            bucket.pause(Duration.ofSeconds(5));

            assertThat(bucket.isPaused()).isTrue();
            assertThat(bucket.availableTokens()).isZero();

            timeMeter.advance(Duration.ofMillis(4_999));
            assertThat(bucket.tryAcquire()).isFalse();
            assertThat(bucket.availableTokens()).isZero();
        }

        @Test
        @DisplayName("Should refill from empty at the normal rate once the pause ends")
        void shouldResumeFromEmpty() {
            bucket.pause(Duration.ofSeconds(5));

            timeMeter.advance(Duration.ofSeconds(5));
            assertThat(bucket.isPaused()).isFalse();
            assertThat(bucket.tryAcquire()).isFalse();

            timeMeter.advance(Duration.ofMillis(200));
            assertThat(bucket.tryAcquire()).isTrue();
            assertThat(bucket.tryAcquire()).isFalse();
        }

        @Test
        @DisplayName("Should count time elapsed after the pause end even if nobody checked at that moment")
        void shouldCountTimeAfterPauseEnd() {
            bucket.pause(Duration.ofSeconds(2));

            timeMeter.advance(Duration.ofMillis(2_400));

            assertThat(bucket.availableTokens()).isEqualTo(2);
        }

        @Test
        @DisplayName("Refill progress made before the pause should not shorten the first wait after it")
        void shouldDropRefillProgressFromBeforePause() {
            TokenBucket slow = new TokenBucket(new RateWindow(Duration.ofMinutes(2), 100), timeMeter);
            for (int i = 0; i < 100; i++) {
                slow.tryAcquire();
            }

            // 1.1s of a 1.2s refill unit is already done when the throttle arrives
            timeMeter.advance(Duration.ofMillis(1_100));
            slow.pause(Duration.ofSeconds(1));

            timeMeter.advance(Duration.ofMillis(1_300));
            assertThat(slow.isPaused()).isFalse();
            assertThat(slow.tryAcquire()).isFalse();

            timeMeter.advance(Duration.ofMillis(900));
            assertThat(slow.tryAcquire()).isTrue();
            assertThat(slow.tryAcquire()).isFalse();
        }

        @Test
        @DisplayName("An absurdly long pause should be capped instead of overflowing")
        void shouldCapHugePause() {
            bucket.pause(Duration.ofSeconds(Long.MAX_VALUE));

            assertThat(bucket.isPaused()).isTrue();
            timeMeter.advance(Duration.ofDays(364));
            assertThat(bucket.tryAcquire()).isFalse();

            timeMeter.advance(Duration.ofDays(1).plusSeconds(1));
            assertThat(bucket.isPaused()).isFalse();
            assertThat(bucket.tryAcquire()).isTrue();
        }

        @Test
        @DisplayName("A refund while paused should not hand out a token")
        void shouldIgnoreRefundWhilePaused() {
            bucket.pause(Duration.ofSeconds(1));
            bucket.refund();

            timeMeter.advance(Duration.ofSeconds(1));
            assertThat(bucket.tryAcquire()).isFalse();
        }

        @Test
        @DisplayName("A shorter pause should not cut an active longer one")
        void shouldNotShortenActivePause() {
            bucket.pause(Duration.ofSeconds(5));
            bucket.pause(Duration.ofSeconds(1));

            timeMeter.advance(Duration.ofSeconds(2));

            assertThat(bucket.isPaused()).isTrue();
            assertThat(bucket.tryAcquire()).isFalse();
        }
    }

    @Nested
    @DisplayName("Blocking acquire")
    class BlockingTests {

        @Test
        @DisplayName("Should suspend the (C+1)-th caller until one refill unit has elapsed")
        void shouldBlockUntilRefill() throws Exception {
            TokenBucket bucket = new TokenBucket(new RateWindow(Duration.ofMillis(400), 2), TimeMeter.SYSTEM_NANOTIME);
            bucket.acquire();
            bucket.acquire();

            long start = System.nanoTime();
            bucket.acquire();
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMillis).isGreaterThanOrEqualTo(150);
        }

        @Test
        @DisplayName("A pause should wake a waiting caller and hold it until the pause ends")
        void shouldExtendWaitOnPause() throws Exception {
            TokenBucket bucket = new TokenBucket(new RateWindow(Duration.ofMillis(500), 5), TimeMeter.SYSTEM_NANOTIME);
            for (int i = 0; i < 5; i++) {
                bucket.acquire();
            }

            long start = System.nanoTime();
            CompletableFuture<Long> waiter = CompletableFuture.supplyAsync(() -> {
                try {
                    bucket.acquire();
                    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            });

            Thread.sleep(20);
            bucket.pause(Duration.ofMillis(500));

            assertThat(waiter.get(3, TimeUnit.SECONDS)).isGreaterThanOrEqualTo(500);
        }

        @Test
        @DisplayName("Should give up at the deadline")
        void shouldTimeOutAtDeadline() throws Exception {
            TokenBucket bucket = new TokenBucket(new RateWindow(Duration.ofSeconds(10), 1), TimeMeter.SYSTEM_NANOTIME);
            bucket.acquire();

            long start = System.nanoTime();
            boolean acquired = bucket.acquire(start + Duration.ofMillis(100).toNanos());

            assertThat(acquired).isFalse();
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(90);
        }
    }

    @Test
    @DisplayName("Should fail fast on a non-positive capacity or duration")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> new RateWindow(WINDOW, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity");
        assertThatThrownBy(() -> new RateWindow(Duration.ZERO, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duration");
    }
}
