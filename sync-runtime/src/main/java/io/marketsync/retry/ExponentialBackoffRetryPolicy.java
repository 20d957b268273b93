package io.marketsync.retry;

import java.time.Duration;

/**
 * Delay after the n-th failed attempt (1-based) is {@code base * multiplier^(n-1)}, capped at {@code max}.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final double multiplier;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, 2.0, maxMillis);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, double multiplier, long maxMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    public static ExponentialBackoffRetryPolicy of(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseDelay.toMillis(), multiplier, maxDelay.toMillis());
    }

    @Override
    public int maxAttempts() { return maxAttempts; }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        double delay = baseMillis * Math.pow(multiplier, Math.min(30, Math.max(0, attempt - 1)));
        if (delay >= maxMillis) return maxMillis;
        return (long) delay;
    }

    public long baseMillis() { return baseMillis; }
    public double multiplier() { return multiplier; }
    public long maxMillis() { return maxMillis; }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryPolicy{maxAttempts=" + maxAttempts + ", baseMillis=" + baseMillis
                + ", multiplier=" + multiplier + ", maxMillis=" + maxMillis + '}';
    }
}
