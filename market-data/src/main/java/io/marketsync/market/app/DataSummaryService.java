package io.marketsync.market.app;

import io.marketsync.market.error.LocalStoreException;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;
import io.marketsync.market.plan.SyncState;
import io.marketsync.market.store.DatasetStore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

public class DataSummaryService {
    private final DatasetStore<PriceBar> prices;
    private final DatasetStore<NewsItem> news;

    public DataSummaryService(DatasetStore<PriceBar> prices, DatasetStore<NewsItem> news) {
        this.prices = prices;
        this.news = news;
    }

    /** Tickers with a dataset of any kind, sorted. */
    public List<String> localTickers() throws LocalStoreException {
        TreeSet<String> all = new TreeSet<>(prices.tickers());
        all.addAll(news.tickers());
        return List.copyOf(all);
    }

    public DataSummary summarize(String ticker) throws LocalStoreException {
        String t = ticker.trim().toUpperCase(Locale.ROOT);
        boolean hasPrices = prices.exists(t);
        SyncState<LocalDate> p = hasPrices ? SyncState.of(prices.load(t), PriceBar::date) : SyncState.empty();
        boolean hasNews = news.exists(t);
        SyncState<Instant> n = hasNews ? SyncState.of(news.load(t), NewsItem::publishTime) : SyncState.empty();
        return new DataSummary(t, hasPrices, p.records(), p.earliest(), p.latest(),
                hasNews, n.records(), n.latest());
    }
}
