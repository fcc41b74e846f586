package com.lolanalyzer.riot.infra;

import java.time.Duration;
import java.util.Objects;

/**
 * One enforced rate constraint: at most {@code capacity} calls per {@code duration}.
 */
public record RateWindow(Duration duration, int capacity) {

    public RateWindow {
        Objects.requireNonNull(duration, "duration");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Window duration must be positive: " + duration);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
        }
    }
}
