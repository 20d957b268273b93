package io.marketsync.runtime;

import com.codahale.metrics.MetricRegistry;
import io.marketsync.core.Outcome;
import io.marketsync.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolCoordinatorTest {
    private final MetricRegistry registry = new MetricRegistry();
    private WorkerPoolCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) coordinator.close();
    }

    @Test
    void neverExceedsWorkerCount() throws Exception {
        coordinator = new WorkerPoolCoordinator(2, new Metrics(registry));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Map<String, Outcome<String>> out = coordinator.runAll(List.of("A", "B", "C", "D", "E", "F"), key -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            running.decrementAndGet();
            return key.toLowerCase();
        });
        assertEquals(6, out.size());
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        assertEquals("c", out.get("C").value());
        assertEquals(6, registry.meter("coordinator.tickers.succeeded").getCount());
    }

    @Test
    void oneFailureDoesNotAffectOthers() throws Exception {
        coordinator = new WorkerPoolCoordinator(3, new Metrics(registry));
        Map<String, Outcome<Integer>> out = coordinator.runAll(List.of("A", "B", "BAD", "C", "D"), key -> {
            if (key.equals("BAD")) throw new IOException("provider down");
            return key.length();
        });
        assertEquals(5, out.size());
        assertTrue(out.get("BAD").isFailure());
        assertEquals("provider down", out.get("BAD").error().orElseThrow().getMessage());
        long ok = out.values().stream().filter(Outcome::isSuccess).count();
        assertEquals(4, ok);
        assertEquals(1, registry.meter("coordinator.tickers.failed").getCount());
    }

    @Test
    void duplicateKeysRunOnce() throws Exception {
        coordinator = new WorkerPoolCoordinator(2, new Metrics(registry));
        AtomicInteger calls = new AtomicInteger();
        Map<String, Outcome<Integer>> out = coordinator.runAll(List.of("A", "A", "B"), key -> calls.incrementAndGet());
        assertEquals(2, out.size());
        assertEquals(2, calls.get());
    }

    @Test
    void stopsWaitingOnStragglersWithoutCancellingThem() throws Exception {
        coordinator = new WorkerPoolCoordinator(2, new Metrics(registry));
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch slowFinished = new CountDownLatch(1);
        Map<String, Outcome<String>> out = coordinator.runAll(List.of("FAST", "SLOW"), key -> {
            if (key.equals("SLOW")) {
                release.await(5, TimeUnit.SECONDS);
                slowFinished.countDown();
            }
            return key;
        }, Duration.ofMillis(200));
        assertTrue(out.get("FAST").isSuccess());
        assertTrue(out.get("SLOW").isFailure());
        assertInstanceOf(TimeoutException.class, out.get("SLOW").error().orElseThrow());
        release.countDown();
        assertTrue(slowFinished.await(5, TimeUnit.SECONDS), "straggler ran to completion");
    }

    @Test
    void reportedTimeoutStaysFailedAfterStragglerCompletes() throws Exception {
        coordinator = new WorkerPoolCoordinator(2, new Metrics(registry));
        CountDownLatch release = new CountDownLatch(1);
        Map<String, Outcome<String>> out = coordinator.runAll(List.of("FAST", "SLOW"), key -> {
            if (key.equals("SLOW")) release.await(5, TimeUnit.SECONDS);
            return key;
        }, Duration.ofMillis(200));
        assertTrue(out.get("SLOW").isFailure());

        release.countDown();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (registry.meter("coordinator.tickers.succeeded").getCount() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(2, registry.meter("coordinator.tickers.succeeded").getCount(), "straggler finished");

        assertTrue(out.get("SLOW").isFailure());
        assertInstanceOf(TimeoutException.class, out.get("SLOW").error().orElseThrow());
        assertEquals(2, out.size());
    }
}
