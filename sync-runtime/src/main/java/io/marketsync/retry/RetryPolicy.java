package io.marketsync.retry;

public interface RetryPolicy {
    int maxAttempts();

    /** attempt is 1-based: the number of attempts already made, including the one that just failed. */
    boolean shouldRetry(int attempt, Exception e);

    /** Delay before the attempt following {@code attempt}. */
    long backoffMillis(int attempt);
}
