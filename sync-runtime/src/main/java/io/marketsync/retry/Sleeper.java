package io.marketsync.retry;

import java.time.Duration;

/**
 * Blocking delay used between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
