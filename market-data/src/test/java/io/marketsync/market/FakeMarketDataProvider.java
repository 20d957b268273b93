package io.marketsync.market;

import io.marketsync.market.error.TransientFetchException;
import io.marketsync.market.fetch.MarketDataProvider;
import io.marketsync.market.fetch.SeriesRequest;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves canned series and news per ticker; tickers in {@link #failing} always throw.
 */
public class FakeMarketDataProvider implements MarketDataProvider {
    public final Map<String, List<PriceBar>> series = new ConcurrentHashMap<>();
    public final Map<String, List<NewsItem>> news = new ConcurrentHashMap<>();
    public final Set<String> failing = ConcurrentHashMap.newKeySet();
    public final List<SeriesRequest> seriesRequests = Collections.synchronizedList(new ArrayList<>());

    @Override
    public List<PriceBar> fetchSeries(SeriesRequest request) throws TransientFetchException {
        seriesRequests.add(request);
        if (failing.contains(request.ticker())) throw new TransientFetchException("boom " + request.ticker());
        List<PriceBar> all = series.getOrDefault(request.ticker(), List.of());
        if (request.isFullHistory()) return all;
        List<PriceBar> out = new ArrayList<>();
        for (PriceBar b : all) {
            if (!b.date().isBefore(request.start()) && b.date().isBefore(request.end())) out.add(b);
        }
        return out;
    }

    @Override
    public List<NewsItem> fetchNews(String ticker, int maxItems) throws TransientFetchException {
        if (failing.contains(ticker)) throw new TransientFetchException("boom " + ticker);
        List<NewsItem> all = news.getOrDefault(ticker, List.of());
        return all.size() > maxItems ? all.subList(0, maxItems) : all;
    }
}
