package io.marketsync.market.pipeline;

import io.marketsync.core.Outcome;
import io.marketsync.market.error.FailureKind;
import io.marketsync.market.model.DataKind;
import io.marketsync.runtime.WorkerPoolCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs every (ticker, kind) pair through its pipeline on the worker pool. A pair is owned by one worker for
 * its whole run; price and news for the same ticker touch different files and may run side by side.
 */
public class MarketSyncRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MarketSyncRunner.class);

    private final WorkerPoolCoordinator coordinator;
    private final Map<DataKind, TickerSyncPipeline<?>> pipelines;

    public MarketSyncRunner(WorkerPoolCoordinator coordinator, Collection<TickerSyncPipeline<?>> pipelines) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.pipelines = new EnumMap<>(DataKind.class);
        for (TickerSyncPipeline<?> p : pipelines) this.pipelines.put(p.kind(), p);
    }

    public Set<DataKind> kinds() { return pipelines.keySet(); }

    /**
     * @return one result per distinct (ticker, kind), tickers in input order, price before news
     */
    public List<TickerResult> run(List<String> tickers) throws InterruptedException {
        Set<String> normalized = new LinkedHashSet<>();
        for (String t : tickers) {
            if (t != null && !t.isBlank()) normalized.add(t.trim().toUpperCase(Locale.ROOT));
        }
        List<TickerJob> jobs = new ArrayList<>();
        for (String t : normalized) {
            for (DataKind k : pipelines.keySet()) jobs.add(new TickerJob(t, k));
        }
        log.info("syncing {} tickers x {} on {} workers", normalized.size(), pipelines.keySet(), coordinator.workers());

        Map<TickerJob, Outcome<TickerResult>> outcomes =
                coordinator.runAll(jobs, job -> pipelines.get(job.kind()).run(job.ticker()));

        List<TickerResult> results = new ArrayList<>(jobs.size());
        for (TickerJob job : jobs) {
            TickerResult r = toResult(job, outcomes.get(job));
            if (r.isFailed()) {
                log.warn("{}", r.summaryLine());
            } else {
                log.info("{}", r.summaryLine());
            }
            results.add(r);
        }
        return results;
    }

    private static TickerResult toResult(TickerJob job, Outcome<TickerResult> outcome) {
        if (outcome == null) {
            return TickerResult.failed(job.ticker(), job.kind(), TickerStage.PENDING, "-",
                    FailureKind.UNEXPECTED, "no result recorded");
        }
        if (outcome.isSuccess()) return outcome.value();
        String error = outcome.error().map(Throwable::toString).orElse("no result");
        return TickerResult.failed(job.ticker(), job.kind(), TickerStage.FAILED, "-", FailureKind.UNEXPECTED, error);
    }

    @Override
    public void close() {
        coordinator.close();
    }

    record TickerJob(String ticker, DataKind kind) {
        @Override
        public String toString() { return ticker + "/" + kind.dirName(); }
    }
}
