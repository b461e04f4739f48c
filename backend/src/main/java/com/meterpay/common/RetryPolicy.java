package com.meterpay.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, capped at a maximum delay. Applied between failover attempts.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, long maxDelayMs) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Delay in milliseconds after the given zero-based attempt: baseDelay * 2^attempt, jittered, then capped.
     */
    public long delayMs(int attempt) {
        if (baseDelayMs == 0) {
            return 0;
        }
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        return Math.min(maxDelayMs, jitter(exponential));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** No wait between attempts. */
    public static RetryPolicy noDelay() {
        return new RetryPolicy(0L, 0.0, 0L);
    }

    /**
     * Default: 250ms base, ±20% jitter, 2s cap.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(250L, 0.2, 2_000L);
    }
}
