package io.marketsync.market.fetch;

import io.marketsync.market.error.TransientFetchException;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;

import java.util.List;

/**
 * Port to an external market-data source. An empty list means the provider has nothing for the request;
 * transport and throttling problems surface as {@link TransientFetchException} so they can be retried.
 */
public interface MarketDataProvider {

    List<PriceBar> fetchSeries(SeriesRequest request) throws TransientFetchException, InterruptedException;

    /** Latest {@code maxItems} news entries, newest first. */
    List<NewsItem> fetchNews(String ticker, int maxItems) throws TransientFetchException, InterruptedException;
}
