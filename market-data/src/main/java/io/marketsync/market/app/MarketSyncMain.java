package io.marketsync.market.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.marketsync.market.config.SyncConfig;
import io.marketsync.market.config.WarehouseConfig;
import io.marketsync.market.error.ConfigurationException;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.model.FetchInterval;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;
import io.marketsync.market.pipeline.MarketSyncRunner;
import io.marketsync.market.pipeline.TickerResult;
import io.marketsync.market.warehouse.WarehouseQueries;
import io.marketsync.metrics.Metrics;
import picocli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI: bring local price/news datasets up to date and push them to the warehouse.
 * Options override {@code MARKETSYNC_*} settings; warehouse credentials come from {@code SNOWFLAKE_*}.
 */
@CommandLine.Command(name = "market-sync", mixinStandardHelpOptions = true,
        description = "Incrementally sync price history and news per ticker into local CSVs and a warehouse")
public final class MarketSyncMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-t", "--ticker"}, split = ",", description = "Tickers (comma-separated or repeat option)")
    List<String> tickers = new ArrayList<>();

    @CommandLine.Option(names = "--type", description = "price|news|all")
    String type;

    @CommandLine.Option(names = "--period", description = "Period for full fetches, e.g. max, 5y")
    String period;

    @CommandLine.Option(names = "--interval", description = "1d|1wk|1mo")
    String interval;

    @CommandLine.Option(names = "--max-items", description = "News items to request per ticker")
    Integer maxItems;

    @CommandLine.Option(names = "--no-upload", description = "Only update local datasets")
    boolean noUpload;

    @CommandLine.Option(names = "--force", description = "Refetch full history even when local data exists")
    boolean force;

    @CommandLine.Option(names = "--workers", description = "Tickers processed concurrently")
    Integer workers;

    @CommandLine.Option(names = "--retry-attempts", description = "Attempts per provider call")
    Integer retryAttempts;

    @CommandLine.Option(names = "--retry-delay-ms", description = "Delay before the first retry; doubles each retry")
    Long retryDelayMs;

    @CommandLine.Option(names = "--backfill-cutoff", description = "History starting on/after this date (yyyy-MM-dd) is refetched in full")
    LocalDate backfillCutoff;

    @CommandLine.Option(names = "--data-dir", description = "Root of the local datasets")
    Path dataDir;

    @CommandLine.Option(names = "--summary", description = "Print what is stored locally and exit")
    boolean summary;

    @CommandLine.Option(names = "--remote-latest", paramLabel = "N",
            description = "Print the newest N warehouse rows per ticker and exit")
    Integer remoteLatest;

    private final PrintStream out;

    public MarketSyncMain() {
        this(System.out);
    }

    MarketSyncMain(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MarketSyncMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        SyncConfig config;
        WarehouseConfig warehouse = null;
        try {
            config = applyOptions(SyncConfig.fromEnv()).validate();
            if (remoteLatest != null || (!config.skipRemote() && !summary)) {
                warehouse = WarehouseConfig.fromEnv().validate();
            }
        } catch (ConfigurationException | IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        Injector injector = Guice.createInjector(new MarketSyncModule(config, warehouse));
        if (summary) {
            printSummary(injector.getInstance(DataSummaryService.class), config.tickers());
            return 0;
        }
        if (config.tickers().isEmpty()) {
            System.err.println("No tickers given (use --ticker or MARKETSYNC_TICKERS)");
            return 2;
        }
        if (remoteLatest != null) {
            WarehouseQueries queries = injector.getInstance(Key.get(new TypeLiteral<Optional<WarehouseQueries>>() {}))
                    .orElseThrow();
            try {
                printRemote(queries, config, Math.max(1, remoteLatest));
            } catch (SQLException e) {
                System.err.println("Warehouse query failed: " + e.getMessage());
                return 1;
            }
            return 0;
        }
        return run(injector, config);
    }

    int run(Injector injector, SyncConfig config) throws InterruptedException {
        List<TickerResult> results;
        try (MarketSyncRunner runner = injector.getInstance(MarketSyncRunner.class)) {
            results = runner.run(config.tickers());
        }
        out.println("Per-ticker summary:");
        int failed = 0;
        for (TickerResult r : results) {
            out.println("  " + r.summaryLine());
            if (r.isFailed()) failed++;
        }
        out.println("Metrics: " + injector.getInstance(Metrics.class).summaryLine());
        out.println((results.size() - failed) + "/" + results.size() + " succeeded"
                + (config.skipRemote() ? " (local only)" : ""));
        return failed == 0 ? 0 : 1;
    }

    SyncConfig applyOptions(SyncConfig base) {
        SyncConfig.Builder b = base.toBuilder();
        if (!tickers.isEmpty()) b.tickers(tickers);
        if (type != null) b.kinds(DataKind.parseSelection(type));
        if (period != null) b.period(period);
        if (interval != null) b.interval(FetchInterval.fromCode(interval));
        if (maxItems != null) b.maxNewsItems(maxItems);
        if (noUpload) b.skipRemote(true);
        if (force) b.forceFull(true);
        if (workers != null) b.workers(workers);
        if (retryAttempts != null) b.retryAttempts(retryAttempts);
        if (retryDelayMs != null) {
            Duration delay = Duration.ofMillis(retryDelayMs);
            b.retryBaseDelay(delay);
            if (base.retryMaxDelay().compareTo(delay) < 0) b.retryMaxDelay(delay);
        }
        if (backfillCutoff != null) b.backfillCutoff(backfillCutoff);
        if (dataDir != null) b.dataDir(dataDir);
        return b.build();
    }

    void printRemote(WarehouseQueries queries, SyncConfig config, int limit) throws SQLException {
        out.println("Warehouse data (newest " + limit + " per ticker):");
        for (String t : config.tickers()) {
            if (config.kinds().contains(DataKind.PRICE_HISTORY)) {
                List<PriceBar> bars = queries.priceHistory(t, null, null);
                out.println("  " + t + " price-history: " + bars.size() + " rows");
                for (PriceBar b : bars.subList(0, Math.min(limit, bars.size()))) {
                    out.println("    " + b.date() + " open=" + b.open() + " high=" + b.high() + " low=" + b.low()
                            + " close=" + b.close() + " volume=" + b.volume());
                }
            }
            if (config.kinds().contains(DataKind.NEWS)) {
                List<NewsItem> items = queries.news(t, limit);
                out.println("  " + t + " news: " + items.size() + " shown");
                for (NewsItem n : items) {
                    out.println("    " + n.publishTime() + " [" + Objects.toString(n.publisher(), "-") + "] "
                            + Objects.toString(n.title(), ""));
                }
            }
        }
    }

    private void printSummary(DataSummaryService service, List<String> only) throws Exception {
        List<String> tickers = only.isEmpty() ? service.localTickers() : only;
        if (tickers.isEmpty()) {
            out.println("No local data.");
            return;
        }
        out.println("Local data summary:");
        for (String t : tickers) out.println("  " + service.summarize(t).render());
    }
}
