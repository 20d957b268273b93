package io.marketsync.market.pipeline;

import io.marketsync.budget.Budget;
import io.marketsync.core.Outcome;
import io.marketsync.market.fetch.MarketDataProvider;
import io.marketsync.market.fetch.SeriesRequest;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.model.PriceBar;
import io.marketsync.market.plan.FetchPlan;
import io.marketsync.market.plan.IncrementalPlanner;
import io.marketsync.market.plan.SyncState;
import io.marketsync.retry.Retrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public class PriceHistoryFetcher implements DatasetFetcher<PriceBar> {
    private static final Logger log = LoggerFactory.getLogger(PriceHistoryFetcher.class);

    private final MarketDataProvider provider;
    private final IncrementalPlanner planner;
    private final Retrier retrier;
    private final Budget budget;
    private final String fullPeriod;

    public PriceHistoryFetcher(MarketDataProvider provider, IncrementalPlanner planner, Retrier retrier,
                               Budget budget, String fullPeriod) {
        this.provider = provider;
        this.planner = planner;
        this.retrier = retrier;
        this.budget = budget;
        this.fullPeriod = fullPeriod;
    }

    @Override
    public FetchResult<PriceBar> fetch(String ticker, List<PriceBar> stored, boolean forceFull) throws InterruptedException {
        SyncState<LocalDate> state = SyncState.of(stored, PriceBar::date);
        FetchPlan plan = planner.plan(state, forceFull);
        log.debug("{} {}: {} (stored {} bars, {}..{})", DataKind.PRICE_HISTORY.dirName(), ticker, plan,
                state.records(), state.earliest(), state.latest());

        SeriesRequest request = switch (plan.type()) {
            case SKIP -> null;
            case FETCH_RANGE -> SeriesRequest.window(ticker, plan.start(), plan.end(), planner.interval());
            case FETCH_FULL -> SeriesRequest.full(ticker, fullPeriod, planner.interval());
        };
        if (request == null) {
            return new FetchResult<>(plan.toString(), Outcome.noData());
        }
        Outcome<List<PriceBar>> outcome = retrier.attempt("price-history " + ticker, () -> {
            budget.acquireExternalOp();
            List<PriceBar> bars = provider.fetchSeries(request);
            return bars.isEmpty() ? Optional.empty() : Optional.of(bars);
        });
        return new FetchResult<>(plan.toString(), outcome);
    }
}
