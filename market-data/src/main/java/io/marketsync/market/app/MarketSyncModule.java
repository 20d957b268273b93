package io.marketsync.market.app;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.marketsync.budget.Budget;
import io.marketsync.budget.TokenBucketBudget;
import io.marketsync.market.config.SyncConfig;
import io.marketsync.market.config.WarehouseConfig;
import io.marketsync.market.fetch.MarketDataProvider;
import io.marketsync.market.fetch.yahoo.HttpYahooClient;
import io.marketsync.market.fetch.yahoo.YahooClient;
import io.marketsync.market.fetch.yahoo.YahooMarketDataProvider;
import io.marketsync.market.merge.MergeEngine;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;
import io.marketsync.market.pipeline.MarketSyncRunner;
import io.marketsync.market.pipeline.NewsFetcher;
import io.marketsync.market.pipeline.PriceHistoryFetcher;
import io.marketsync.market.pipeline.TickerSyncPipeline;
import io.marketsync.market.plan.IncrementalPlanner;
import io.marketsync.market.store.CsvDatasetStore;
import io.marketsync.market.store.DatasetStore;
import io.marketsync.market.warehouse.JdbcWarehouseSessionFactory;
import io.marketsync.market.warehouse.NewsTable;
import io.marketsync.market.warehouse.PriceHistoryTable;
import io.marketsync.market.warehouse.WarehouseQueries;
import io.marketsync.market.warehouse.WarehouseSessionFactory;
import io.marketsync.market.warehouse.WarehouseSyncEngine;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.Retrier;
import io.marketsync.retry.RetryPolicy;
import io.marketsync.retry.Sleeper;
import io.marketsync.runtime.WorkerPoolCoordinator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Wires a sync run from a {@link SyncConfig}. Pass a null {@link WarehouseConfig} when remote sync is off.
 */
public class MarketSyncModule extends AbstractModule {
    private final SyncConfig config;
    private final WarehouseConfig warehouse;

    public MarketSyncModule(SyncConfig config, WarehouseConfig warehouse) {
        this.config = config;
        this.warehouse = warehouse;
    }

    @Override
    protected void configure() {
        bind(SyncConfig.class).toInstance(config);
    }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton Sleeper sleeper() { return Sleeper.SYSTEM; }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return ExponentialBackoffRetryPolicy.of(config.retryAttempts(), config.retryBaseDelay(),
                config.retryMultiplier(), config.retryMaxDelay());
    }

    @Provides @Singleton Retrier retrier(RetryPolicy policy, Sleeper sleeper, Metrics metrics) {
        return new Retrier(policy, sleeper, metrics);
    }

    @Provides @Singleton Budget budget() { return new TokenBucketBudget(config.providerQps()); }

    @Provides @Singleton YahooClient yahooClient() { return new HttpYahooClient(); }

    @Provides @Singleton MarketDataProvider provider(YahooClient client) { return new YahooMarketDataProvider(client); }

    @Provides @Singleton DatasetStore<PriceBar> priceStore() { return CsvDatasetStore.prices(config.dataDir()); }

    @Provides @Singleton DatasetStore<NewsItem> newsStore() { return CsvDatasetStore.news(config.dataDir()); }

    @Provides @Singleton IncrementalPlanner planner(Clock clock) {
        return new IncrementalPlanner(clock, config.backfillCutoff(), config.interval());
    }

    @Provides @Singleton DataSummaryService summaryService(DatasetStore<PriceBar> prices, DatasetStore<NewsItem> news) {
        return new DataSummaryService(prices, news);
    }

    @Provides @Singleton Optional<WarehouseSessionFactory> sessionFactory() {
        if (config.skipRemote() || warehouse == null) return Optional.empty();
        warehouse.validate();
        return Optional.of(new JdbcWarehouseSessionFactory(warehouse.jdbcUrl(), warehouse.connectionProperties()));
    }

    /** Read access needs connection settings only; it is available even when uploads are off. */
    @Provides @Singleton Optional<WarehouseQueries> warehouseQueries() {
        if (warehouse == null) return Optional.empty();
        return Optional.of(new WarehouseQueries(
                new JdbcWarehouseSessionFactory(warehouse.jdbcUrl(), warehouse.connectionProperties()),
                new PriceHistoryTable(warehouse.priceTable()), new NewsTable(warehouse.newsTable())));
    }

    @Provides @Singleton
    MarketSyncRunner runner(MarketDataProvider provider, IncrementalPlanner planner, Retrier retrier, Budget budget,
                            DatasetStore<PriceBar> prices, DatasetStore<NewsItem> news,
                            Optional<WarehouseSessionFactory> sessions, Clock clock, Metrics metrics) {
        String priceTable = warehouse == null ? PriceHistoryTable.DEFAULT_NAME : warehouse.priceTable();
        String newsTable = warehouse == null ? NewsTable.DEFAULT_NAME : warehouse.newsTable();

        List<TickerSyncPipeline<?>> pipelines = new ArrayList<>();
        if (config.kinds().contains(DataKind.PRICE_HISTORY)) {
            WarehouseSyncEngine<PriceBar> remote = sessions
                    .map(s -> new WarehouseSyncEngine<>(s, new PriceHistoryTable(priceTable), clock, metrics))
                    .orElse(null);
            pipelines.add(new TickerSyncPipeline<>(DataKind.PRICE_HISTORY, prices,
                    new PriceHistoryFetcher(provider, planner, retrier, budget, config.period()),
                    MergeEngine.forPrices(), remote, config.remoteScope(), config.requireInitialFetch(),
                    config.forceFull(), metrics));
        }
        if (config.kinds().contains(DataKind.NEWS)) {
            WarehouseSyncEngine<NewsItem> remote = sessions
                    .map(s -> new WarehouseSyncEngine<>(s, new NewsTable(newsTable), clock, metrics))
                    .orElse(null);
            pipelines.add(new TickerSyncPipeline<>(DataKind.NEWS, news,
                    new NewsFetcher(provider, retrier, budget, config.maxNewsItems()),
                    MergeEngine.forNews(), remote, config.remoteScope(), config.requireInitialFetch(),
                    config.forceFull(), metrics));
        }
        return new MarketSyncRunner(new WorkerPoolCoordinator(config.workers(), metrics), pipelines);
    }
}
