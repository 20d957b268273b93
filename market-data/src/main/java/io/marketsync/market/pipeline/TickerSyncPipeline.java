package io.marketsync.market.pipeline;

import io.marketsync.market.config.SyncScope;
import io.marketsync.market.error.FailureKind;
import io.marketsync.market.error.SyncException;
import io.marketsync.market.merge.MergeEngine;
import io.marketsync.market.merge.MergeResult;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.store.DatasetStore;
import io.marketsync.market.warehouse.RemoteSyncResult;
import io.marketsync.market.warehouse.WarehouseSyncEngine;
import io.marketsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fetch, merge, persist and optionally upload one ticker's dataset of one kind. Steps run strictly in that
 * order; every failure is turned into a {@link TickerResult} so the caller never has to catch.
 */
public class TickerSyncPipeline<R> {
    private static final Logger log = LoggerFactory.getLogger(TickerSyncPipeline.class);

    private final DataKind kind;
    private final DatasetStore<R> store;
    private final DatasetFetcher<R> fetcher;
    private final MergeEngine<R, ?> merge;
    private final WarehouseSyncEngine<R> remote; // null when remote sync is off
    private final SyncScope scope;
    private final boolean requireInitialFetch;
    private final boolean forceFull;
    private final Metrics metrics;

    public TickerSyncPipeline(DataKind kind, DatasetStore<R> store, DatasetFetcher<R> fetcher, MergeEngine<R, ?> merge,
                              WarehouseSyncEngine<R> remote, SyncScope scope, boolean requireInitialFetch,
                              boolean forceFull, Metrics metrics) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.store = Objects.requireNonNull(store, "store");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.merge = Objects.requireNonNull(merge, "merge");
        this.remote = remote;
        this.scope = Objects.requireNonNull(scope, "scope");
        this.requireInitialFetch = requireInitialFetch;
        this.forceFull = forceFull;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public DataKind kind() { return kind; }

    public TickerResult run(String ticker) throws InterruptedException {
        AtomicReference<TickerStage> stage = new AtomicReference<>(TickerStage.PENDING);
        String plan = "-";
        try {
            List<R> stored = store.load(ticker);

            stage.set(TickerStage.FETCHING);
            FetchResult<R> fetched = fetcher.fetch(ticker, stored, forceFull);
            plan = fetched.plan();
            if (fetched.outcome().exhausted() && stored.isEmpty() && requireInitialFetch) {
                String cause = fetched.outcome().error().map(Throwable::toString).orElse("unknown");
                return TickerResult.failed(ticker, kind, TickerStage.FETCHING, plan, FailureKind.TRANSIENT_FETCH,
                        "initial fetch failed after " + fetched.outcome().attempts() + " attempts: " + cause);
            }
            List<R> incoming = fetched.records();

            stage.set(TickerStage.MERGING);
            MergeResult<R> merged = merge.merge(stored, incoming);
            metrics.counter("merge.records.added").inc(merged.added());
            metrics.counter("merge.duplicates.removed").inc(merged.duplicatesRemoved());
            if (!incoming.isEmpty() || merged.total() != stored.size()) {
                store.replace(ticker, merged.records());
            }
            stage.set(TickerStage.LOCAL_SAVED);

            Long remoteAdded = null;
            if (remote != null) {
                List<R> rows = scope == SyncScope.DATASET ? merged.records() : merge.dedupe(incoming);
                if (!rows.isEmpty()) {
                    RemoteSyncResult r = remote.sync(ticker, rows, s -> stage.set(switch (s) {
                        case UPSERT, CLEANUP, DONE -> TickerStage.UPSERTING;
                        default -> TickerStage.STAGING;
                    }));
                    remoteAdded = r.rowsAdded();
                    stage.set(TickerStage.REMOTE_SYNCED);
                }
            }

            stage.set(TickerStage.DONE);
            boolean anythingNew = merged.added() > 0 || (remoteAdded != null && remoteAdded > 0);
            return new TickerResult(ticker, kind,
                    anythingNew ? TickerResult.Status.SUCCEEDED : TickerResult.Status.NO_NEW_DATA,
                    TickerStage.DONE, plan, incoming.size(), merged.total(), merged.added(),
                    merged.duplicatesRemoved(), remoteAdded, null, null);
        } catch (SyncException e) {
            log.error("{} {}: failed at {}: {}", kind.dirName(), ticker, stage.get(), e.getMessage());
            return TickerResult.failed(ticker, kind, stage.get(), plan, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} {}: unexpected failure at {}", kind.dirName(), ticker, stage.get(), e);
            return TickerResult.failed(ticker, kind, stage.get(), plan, FailureKind.UNEXPECTED, e.toString());
        }
    }
}
