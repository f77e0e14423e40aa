package com.ethindexer.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with ±jitter for RPC retries. Delay is capped so a long outage
 * does not push a single retry beyond the cap.
 */
public final class RetryPolicy {

    private static final long DEFAULT_MAX_DELAY_MS = 60_000L;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, DEFAULT_MAX_DELAY_MS);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
    }

    /**
     * Delay in milliseconds after the given zero-based failed attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, ±20% jitter, 5 max attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 5);
    }
}
