package io.marketsync.retry;

import io.marketsync.core.Outcome;
import io.marketsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Runs an operation under a {@link RetryPolicy}. Every failure is logged and followed by the policy's
 * backoff delay on the injected {@link Sleeper}. Exhausting the policy yields {@link Outcome#exhausted}
 * rather than an exception: callers decide whether "nothing fetched" is acceptable.
 */
public class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Metrics metrics; // optional

    public Retrier(RetryPolicy policy, Sleeper sleeper) {
        this(policy, sleeper, null);
    }

    public Retrier(RetryPolicy policy, Sleeper sleeper, Metrics metrics) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.metrics = metrics;
    }

    /**
     * @param name      label used in log lines, e.g. {@code "price-history AAPL"}
     * @param operation returns a value, or empty when the upstream legitimately has nothing
     */
    public <T> Outcome<T> attempt(String name, Callable<Optional<T>> operation) throws InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            if (metrics != null) metrics.counter("fetch.attempts").inc();
            try {
                Optional<T> result = operation.call();
                if (result == null || result.isEmpty()) {
                    return Outcome.noData(attempt);
                }
                return Outcome.success(result.get(), attempt);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception e) {
                if (metrics != null) metrics.counter("fetch.failures").inc();
                if (!policy.shouldRetry(attempt, e)) {
                    log.error("{}: all {} attempts failed, last error: {}", name, attempt, e.toString());
                    if (metrics != null) metrics.counter("fetch.exhausted").inc();
                    return Outcome.exhausted(e, attempt);
                }
                long delay = policy.backoffMillis(attempt);
                log.warn("{}: attempt {}/{} failed ({}), retrying in {} ms",
                        name, attempt, policy.maxAttempts(), e.toString(), delay);
                sleeper.sleep(Duration.ofMillis(delay));
            }
        }
    }
}
