package io.marketsync.market.pipeline;

import io.marketsync.budget.Budget;
import io.marketsync.core.Outcome;
import io.marketsync.market.fetch.MarketDataProvider;
import io.marketsync.market.model.NewsItem;
import io.marketsync.retry.Retrier;

import java.util.List;
import java.util.Optional;

/**
 * News has no date window upstream: every run asks for the latest items and lets the merge drop the ones
 * already stored.
 */
public class NewsFetcher implements DatasetFetcher<NewsItem> {
    private final MarketDataProvider provider;
    private final Retrier retrier;
    private final Budget budget;
    private final int maxItems;

    public NewsFetcher(MarketDataProvider provider, Retrier retrier, Budget budget, int maxItems) {
        this.provider = provider;
        this.retrier = retrier;
        this.budget = budget;
        this.maxItems = maxItems;
    }

    @Override
    public FetchResult<NewsItem> fetch(String ticker, List<NewsItem> stored, boolean forceFull) throws InterruptedException {
        String plan = "latest " + maxItems;
        Outcome<List<NewsItem>> outcome = retrier.attempt("news " + ticker, () -> {
            budget.acquireExternalOp();
            List<NewsItem> items = provider.fetchNews(ticker, maxItems);
            return items.isEmpty() ? Optional.empty() : Optional.of(items);
        });
        return new FetchResult<>(plan, outcome);
    }
}
