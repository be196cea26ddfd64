package com.ace.eval.execution;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with equal jitter: the delay for attempt n lies in [c/2, c] where
 * c = min(cap, base * 2^(n-1)).
 */
public class BackoffPolicy {
    private static final int MAX_SHIFT = 30;

    private final Duration base;
    private final Duration cap;
    private final Random random;

    public BackoffPolicy(Duration base, Duration cap, Random random) {
        if (base.isNegative() || base.isZero() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff needs 0 < base <= cap, got base=" + base + " cap=" + cap);
        }
        this.base = base;
        this.cap = cap;
        this.random = random;
    }

    public Duration ceiling(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempts are numbered from 1, got " + attempt);
        }
        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long millis = base.toMillis() << shift;
        return millis <= 0 || millis > cap.toMillis() ? cap : Duration.ofMillis(millis);
    }

    public Duration delayFor(int attempt) {
        long ceiling = ceiling(attempt).toMillis();
        long floor = ceiling / 2;
        long jitter = (long) (random.nextDouble() * (ceiling - floor + 1));
        return Duration.ofMillis(Math.min(ceiling, floor + jitter));
    }
}
