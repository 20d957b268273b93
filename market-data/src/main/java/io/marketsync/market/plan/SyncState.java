package io.marketsync.market.plan;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;

/**
 * Summary of what is already stored for one ticker: record count and the earliest/latest position
 * (a date for series, a publish time for news). Both bounds are null when nothing is stored.
 */
public record SyncState<T extends Comparable<? super T>>(int records, T earliest, T latest) {

    public static <T extends Comparable<? super T>> SyncState<T> empty() {
        return new SyncState<>(0, null, null);
    }

    public static <R, T extends Comparable<? super T>> SyncState<T> of(Collection<R> records, Function<R, T> position) {
        Objects.requireNonNull(position, "position");
        T min = null;
        T max = null;
        for (R r : records) {
            T p = position.apply(r);
            if (p == null) continue;
            if (min == null || p.compareTo(min) < 0) min = p;
            if (max == null || p.compareTo(max) > 0) max = p;
        }
        return new SyncState<>(records.size(), min, max);
    }

    public boolean isEmpty() { return latest == null; }
}
