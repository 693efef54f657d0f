package uk.gegc.coursemaker.shared.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff: {@code base * 2^(attempt-1)}, scaled by a random jitter in
 * {@code [1 - jitterFactor, 1 + jitterFactor]} and capped at {@code max}.
 */
public final class ExponentialBackoff {

    private final Duration base;
    private final Duration max;
    private final double jitterFactor;

    public ExponentialBackoff(Duration base, Duration max, double jitterFactor) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Backoff base must be positive");
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff max must be >= base");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("Jitter factor must be in [0, 1)");
        }
        this.base = base;
        this.max = max;
        this.jitterFactor = jitterFactor;
    }

    /**
     * @param attempt 1-based attempt number that just failed
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        double exponentialMillis = base.toMillis() * Math.pow(2, exponent);

        double jitter = 1.0;
        if (jitterFactor > 0.0) {
            jitter = (1.0 - jitterFactor) + ThreadLocalRandom.current().nextDouble() * 2 * jitterFactor;
        }

        long delayMillis = (long) Math.min(exponentialMillis * jitter, (double) max.toMillis());
        return Duration.ofMillis(delayMillis);
    }
}
