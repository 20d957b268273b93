package io.marketsync.budget;

/**
 * Budget governs calls against an external, rate-limited provider.
 */
public interface Budget extends AutoCloseable {
    /** Block as needed to respect the external QPS budget (one op). */
    void acquireExternalOp() throws InterruptedException;

    /** A budget that never blocks. */
    static Budget unlimited() {
        return () -> {};
    }

    @Override
    default void close() {}
}
