package io.marketsync.market.pipeline;

import com.codahale.metrics.MetricRegistry;
import io.marketsync.budget.Budget;
import io.marketsync.market.FakeMarketDataProvider;
import io.marketsync.market.TestData;
import io.marketsync.market.config.SyncScope;
import io.marketsync.market.error.FailureKind;
import io.marketsync.market.merge.MergeEngine;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.model.FetchInterval;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;
import io.marketsync.market.plan.IncrementalPlanner;
import io.marketsync.market.store.CsvDatasetStore;
import io.marketsync.market.warehouse.H2Warehouse;
import io.marketsync.market.warehouse.JdbcWarehouseSession;
import io.marketsync.market.warehouse.NewsTable;
import io.marketsync.market.warehouse.PriceHistoryTable;
import io.marketsync.market.warehouse.SqlDialect;
import io.marketsync.market.warehouse.TableSchema;
import io.marketsync.market.warehouse.WarehouseSessionFactory;
import io.marketsync.market.warehouse.WarehouseSyncEngine;
import io.marketsync.metrics.Metrics;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.Retrier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.DriverManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TickerSyncPipelineTest {
    private static final LocalDate D0 = LocalDate.of(2024, 1, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private final FakeMarketDataProvider provider = new FakeMarketDataProvider();
    private final Metrics metrics = new Metrics(new MetricRegistry());
    private final H2Warehouse h2 = new H2Warehouse();
    private final List<Duration> sleeps = new ArrayList<>();
    private final Retrier retrier = new Retrier(new ExponentialBackoffRetryPolicy(3, 2_000, 60_000), sleeps::add, metrics);

    private TickerSyncPipeline<PriceBar> prices(WarehouseSessionFactory sessions, LocalDate cutoff, boolean requireInitial) {
        IncrementalPlanner planner = new IncrementalPlanner(CLOCK, cutoff, FetchInterval.DAILY);
        WarehouseSyncEngine<PriceBar> remote = sessions == null ? null
                : new WarehouseSyncEngine<>(sessions, new PriceHistoryTable(), CLOCK, metrics);
        return new TickerSyncPipeline<>(DataKind.PRICE_HISTORY, CsvDatasetStore.prices(dir),
                new PriceHistoryFetcher(provider, planner, retrier, Budget.unlimited(), "max"),
                MergeEngine.forPrices(), remote, SyncScope.DATASET, requireInitial, false, metrics);
    }

    private TickerSyncPipeline<PriceBar> prices(WarehouseSessionFactory sessions) {
        return prices(sessions, LocalDate.of(2000, 1, 1), true);
    }

    @Test
    void firstRunStoresLocallyAndUploadsEverything() throws Exception {
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 10));

        TickerResult r = prices(h2.sessions()).run("AAPL");

        assertEquals(TickerResult.Status.SUCCEEDED, r.status());
        assertEquals(TickerStage.DONE, r.stage());
        assertEquals(10, r.total());
        assertEquals(10, r.added());
        assertEquals(10L, r.remoteRowsAdded());
        assertEquals(10, CsvDatasetStore.prices(dir).load("AAPL").size());
        assertEquals(10, h2.rows(PriceHistoryTable.DEFAULT_NAME, "AAPL"));
    }

    @Test
    void overlappingRefetchAddsOnlyNewRowsLocallyAndRemotely() throws Exception {
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 10));
        prices(h2.sessions()).run("AAPL");
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 12));

        TickerResult r = prices(h2.sessions()).run("AAPL");

        assertEquals(12, r.fetched());
        assertEquals(2, r.added());
        assertEquals(10, r.duplicatesRemoved());
        assertEquals(12, r.total());
        assertEquals(2L, r.remoteRowsAdded());
        assertEquals(12, h2.rows(PriceHistoryTable.DEFAULT_NAME, "AAPL"));
    }

    @Test
    void rerunWithNothingNewChangesNothing() throws Exception {
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 12));
        prices(h2.sessions()).run("AAPL");
        String before = Files.readString(CsvDatasetStore.prices(dir).pathFor("AAPL"));

        TickerResult r = prices(h2.sessions()).run("AAPL");

        assertEquals(TickerResult.Status.NO_NEW_DATA, r.status());
        assertEquals(0, r.added());
        assertEquals(0L, r.remoteRowsAdded());
        assertEquals(before, Files.readString(CsvDatasetStore.prices(dir).pathFor("AAPL")));
        assertEquals(12, h2.rows(PriceHistoryTable.DEFAULT_NAME, "AAPL"));
    }

    @Test
    void completeHistoryIsExtendedWithAWindowFetch() throws Exception {
        List<PriceBar> history = new ArrayList<>(TestData.bars("SPY", LocalDate.of(1999, 12, 1), 5));
        history.addAll(TestData.bars("SPY", LocalDate.of(2024, 1, 25), 10)); // through 2024-02-03
        CsvDatasetStore.prices(dir).replace("SPY", history.subList(0, 8)); // stored through 2024-01-27
        provider.series.put("SPY", history);

        TickerResult r = prices(null).run("SPY");

        assertEquals("FetchRange(2024-01-28..2024-02-01)", r.plan());
        assertTrue(provider.seriesRequests.stream().noneMatch(req -> req.isFullHistory()));
        assertEquals(4, r.added()); // 01-28 .. 01-31, today excluded
        assertNull(r.remoteRowsAdded());
    }

    @Test
    void verificationFailureKeepsLocalSaveAndReportsStage() throws Exception {
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 10));
        prices(h2.sessions()).run("AAPL");
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 12));
        WarehouseSessionFactory lossy = () -> new JdbcWarehouseSession(DriverManager.getConnection(h2.url), SqlDialect.GENERIC) {
            @Override
            public int writeStaging(String staging, TableSchema schema, List<Object[]> rows) {
                return rows.size();
            }
        };

        TickerResult r = prices(lossy).run("AAPL");

        assertEquals(TickerResult.Status.FAILED, r.status());
        assertEquals(FailureKind.REMOTE_WRITE_VERIFICATION, r.failureKind());
        assertEquals(TickerStage.STAGING, r.stage());
        assertEquals(12, CsvDatasetStore.prices(dir).load("AAPL").size());
        assertEquals(10, h2.rows(PriceHistoryTable.DEFAULT_NAME, "AAPL"));
        assertEquals(0, h2.stagingTables());
    }

    @Test
    void exhaustedFirstFetchFailsTheTicker() throws Exception {
        provider.failing.add("DEAD");

        TickerResult r = prices(h2.sessions()).run("DEAD");

        assertEquals(TickerResult.Status.FAILED, r.status());
        assertEquals(FailureKind.TRANSIENT_FETCH, r.failureKind());
        assertEquals(List.of(Duration.ofMillis(2_000), Duration.ofMillis(4_000)), sleeps);
        assertFalse(CsvDatasetStore.prices(dir).exists("DEAD"));
    }

    @Test
    void exhaustedFetchWithLocalDataIsNoNewData() throws Exception {
        CsvDatasetStore.prices(dir).replace("FLAKY", TestData.bars("FLAKY", D0, 3));
        provider.failing.add("FLAKY");

        TickerResult r = prices(null).run("FLAKY");

        assertEquals(TickerResult.Status.NO_NEW_DATA, r.status());
        assertEquals(3, r.total());
    }

    @Test
    void exhaustedFirstFetchIsToleratedWhenNotRequired() throws Exception {
        provider.failing.add("DEAD");

        TickerResult r = prices(null, LocalDate.of(2000, 1, 1), false).run("DEAD");

        assertEquals(TickerResult.Status.NO_NEW_DATA, r.status());
        assertEquals(0, r.total());
    }

    @Test
    void unreadableLocalDatasetFailsBeforeFetching() throws Exception {
        Path file = CsvDatasetStore.prices(dir).pathFor("BAD");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "garbage\n");

        TickerResult r = prices(null).run("BAD");

        assertEquals(FailureKind.LOCAL_READ, r.failureKind());
        assertEquals(TickerStage.PENDING, r.stage());
        assertTrue(provider.seriesRequests.isEmpty());
    }

    @Test
    void localWriteFailureStopsBeforeRemoteSync() throws Exception {
        provider.series.put("AAPL", TestData.bars("AAPL", D0, 10));
        // a plain file where the ticker directory belongs: nothing to load, nothing can be written
        Path tickerDir = CsvDatasetStore.prices(dir).pathFor("AAPL").getParent();
        Files.createDirectories(tickerDir.getParent());
        Files.writeString(tickerDir, "not a directory");

        TickerResult r = prices(h2.sessions()).run("AAPL");

        assertEquals(TickerResult.Status.FAILED, r.status());
        assertEquals(FailureKind.LOCAL_WRITE, r.failureKind());
        assertEquals(TickerStage.MERGING, r.stage());
        assertEquals(1, provider.seriesRequests.size());
        assertEquals(1, metrics.counter("fetch.attempts").getCount());
        assertEquals(0, h2.count("SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = '"
                + PriceHistoryTable.DEFAULT_NAME + "'"));
    }

    @Test
    void newsRunMergesLatestItems() throws Exception {
        Instant t = Instant.parse("2024-01-31T12:00:00Z");
        CsvDatasetStore<NewsItem> store = CsvDatasetStore.news(dir);
        store.replace("MSFT", List.of(TestData.news("MSFT", "a", t.minusSeconds(7200))));
        provider.news.put("MSFT", List.of(TestData.news("MSFT", "b", t), TestData.news("MSFT", "a", t.minusSeconds(7200))));
        TickerSyncPipeline<NewsItem> pipeline = new TickerSyncPipeline<>(DataKind.NEWS, store,
                new NewsFetcher(provider, retrier, Budget.unlimited(), 10), MergeEngine.forNews(),
                new WarehouseSyncEngine<>(h2.sessions(), new NewsTable(), CLOCK, metrics),
                SyncScope.BATCH, true, false, metrics);

        TickerResult r = pipeline.run("MSFT");

        assertEquals(1, r.added());
        assertEquals(List.of("b", "a"), store.load("MSFT").stream().map(NewsItem::id).toList());
        assertEquals(2L, r.remoteRowsAdded());
    }
}
