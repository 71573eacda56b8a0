package com.walletfeed.jobs;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for failed background jobs.
 */
public final class JobRetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public JobRetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0");
        }
        if (jitterFactor < 0 || jitterFactor >= 1) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the attempt following {@code failedAttempt} (one-based):
     * {@code baseDelay * 2^(failedAttempt - 1)} with jitter applied.
     */
    public long delayMs(int failedAttempt) {
        int exponent = Math.min(Math.max(failedAttempt - 1, 0), 20);
        return jitter(baseDelayMs * (1L << exponent));
    }

    public boolean canRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }
}
