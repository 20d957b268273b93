package io.marketsync.runtime;

/**
 * Unit of work run by the {@link WorkerPoolCoordinator} for one key, start to finish on one worker.
 */
@FunctionalInterface
public interface KeyedTask<K, R> {
    R run(K key) throws Exception;
}
