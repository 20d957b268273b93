package io.marketsync.market.merge;

import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Unions stored and fetched records, keeps the last occurrence of each key (fetched rows win over stored
 * ones) and sorts the result. Pure; never touches storage.
 */
public class MergeEngine<R, K> {
    private final Function<R, K> key;
    private final Comparator<R> order;

    public MergeEngine(Function<R, K> key, Comparator<R> order) {
        this.key = Objects.requireNonNull(key, "key");
        this.order = Objects.requireNonNull(order, "order");
    }

    /** Oldest bar first. */
    public static MergeEngine<PriceBar, PriceBar.Key> forPrices() {
        return new MergeEngine<>(PriceBar::key,
                Comparator.comparing(PriceBar::date).thenComparing(PriceBar::ticker));
    }

    /** Newest item first; items without a publish time go last. */
    public static MergeEngine<NewsItem, NewsItem.Key> forNews() {
        return new MergeEngine<>(NewsItem::key,
                Comparator.comparing(NewsItem::publishTime, Comparator.<Instant>nullsLast(Comparator.reverseOrder()))
                        .thenComparing(NewsItem::id));
    }

    public MergeResult<R> merge(List<R> existing, List<R> incoming) {
        Map<K, R> byKey = new LinkedHashMap<>();
        for (R r : existing) byKey.put(key.apply(r), r);
        Set<K> before = new HashSet<>(byKey.keySet());
        for (R r : incoming) byKey.put(key.apply(r), r);

        int added = 0;
        for (K k : byKey.keySet()) {
            if (!before.contains(k)) added++;
        }
        List<R> merged = new ArrayList<>(byKey.values());
        merged.sort(order);
        int duplicates = existing.size() + incoming.size() - merged.size();
        return new MergeResult<>(merged, existing.size(), incoming.size(), added, duplicates);
    }

    /** Drops repeated keys within one batch, keeping the last occurrence of each. */
    public List<R> dedupe(List<R> batch) {
        Map<K, R> byKey = new LinkedHashMap<>();
        for (R r : batch) {
            K k = key.apply(r);
            byKey.remove(k);
            byKey.put(k, r);
        }
        return new ArrayList<>(byKey.values());
    }
}
