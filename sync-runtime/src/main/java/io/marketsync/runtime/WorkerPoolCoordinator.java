package io.marketsync.runtime;

import com.codahale.metrics.Timer;
import io.marketsync.core.Outcome;
import io.marketsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans keyed tasks out over a fixed pool of workers. Each key is processed by exactly one worker from start
 * to finish; a task's exception becomes that key's {@link Outcome#failure} and never affects other keys.
 * Results carry no ordering guarantee across keys.
 */
public class WorkerPoolCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPoolCoordinator.class);

    private final int workers;
    private final ExecutorService workerPool;
    private final Metrics metrics;

    public WorkerPoolCoordinator(int workers, Metrics metrics) {
        this(workers, metrics, "sync-worker");
    }

    public WorkerPoolCoordinator(int workers, Metrics metrics, String threadPrefix) {
        this.workers = Math.max(1, workers);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        AtomicInteger n = new AtomicInteger();
        this.workerPool = Executors.newFixedThreadPool(this.workers, r -> {
            Thread t = new Thread(r, threadPrefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public int workers() { return workers; }

    public <K, R> Map<K, Outcome<R>> runAll(Collection<K> keys, KeyedTask<K, R> task) throws InterruptedException {
        return runAll(keys, task, null);
    }

    /**
     * @param maxWait how long to wait for all keys; keys still running afterwards are reported as failed with a
     *                {@link TimeoutException}, but their work is not cancelled. {@code null} waits indefinitely.
     * @return a snapshot; a straggler finishing later does not change it
     */
    public <K, R> Map<K, Outcome<R>> runAll(Collection<K> keys, KeyedTask<K, R> task, Duration maxWait)
            throws InterruptedException {
        Objects.requireNonNull(task, "task");
        Map<K, Outcome<R>> results = new ConcurrentHashMap<>();
        Map<K, Future<?>> futures = new LinkedHashMap<>();
        for (K key : new LinkedHashSet<>(keys)) {
            futures.put(key, workerPool.submit(() -> runOne(key, task, results)));
        }

        long deadline = maxWait == null ? Long.MAX_VALUE : System.nanoTime() + maxWait.toNanos();
        for (Map.Entry<K, Future<?>> e : futures.entrySet()) {
            try {
                if (maxWait == null) {
                    e.getValue().get();
                } else {
                    long remaining = Math.max(0, deadline - System.nanoTime());
                    e.getValue().get(remaining, TimeUnit.NANOSECONDS);
                }
            } catch (TimeoutException te) {
                log.warn("{}: still running after {}, no longer waiting for it", e.getKey(), maxWait);
                results.putIfAbsent(e.getKey(), Outcome.failure(
                        new TimeoutException(e.getKey() + " still running after " + maxWait)));
            } catch (ExecutionException ee) {
                // runOne captures task failures itself; this only happens if recording the result blew up
                Throwable cause = ee.getCause();
                results.putIfAbsent(e.getKey(), Outcome.failure(
                        cause instanceof Exception ex ? ex : new RuntimeException(cause)));
            }
        }
        // stragglers keep writing into results after we return
        return Map.copyOf(results);
    }

    private <K, R> void runOne(K key, KeyedTask<K, R> task, Map<K, Outcome<R>> results) {
        try (Timer.Context ignored = metrics.timer("coordinator.ticker.time").time()) {
            R r = task.run(key);
            results.put(key, r == null ? Outcome.noData() : Outcome.success(r));
            metrics.meter("coordinator.tickers.succeeded").mark();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            results.put(key, Outcome.failure(ie));
            metrics.meter("coordinator.tickers.failed").mark();
        } catch (Exception e) {
            log.error("{}: task failed: {}", key, e.toString(), e);
            results.put(key, Outcome.failure(e));
            metrics.meter("coordinator.tickers.failed").mark();
        }
    }

    @Override
    public void close() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) workerPool.shutdownNow();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }
}
