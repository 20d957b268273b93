package io.marketsync.market.config;

import io.marketsync.market.error.ConfigurationException;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.model.FetchInterval;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

public record SyncConfig(
        Path dataDir,
        List<String> tickers,
        Set<DataKind> kinds,
        String period,
        FetchInterval interval,
        int maxNewsItems,
        boolean skipRemote,
        boolean forceFull,
        int workers,
        int retryAttempts,
        Duration retryBaseDelay,
        double retryMultiplier,
        Duration retryMaxDelay,
        long providerQps,
        LocalDate backfillCutoff,
        boolean requireInitialFetch,
        SyncScope remoteScope
) {
    public SyncConfig {
        tickers = tickers.stream().map(t -> t.trim().toUpperCase(Locale.ROOT)).filter(t -> !t.isEmpty()).distinct().toList();
        kinds = Set.copyOf(kinds);
    }

    public static SyncConfig fromEnv() {
        return from(System::getProperty, System.getenv());
    }

    /** System property {@code marketsync.x} wins over environment variable {@code MARKETSYNC_X}. */
    public static SyncConfig from(Function<String, String> properties, Map<String, String> env) {
        Function<String, String> get = key -> {
            String v = properties.apply("marketsync." + key);
            return v != null ? v : env.get("MARKETSYNC_" + key.toUpperCase(Locale.ROOT).replace('.', '_'));
        };
        List<String> problems = new ArrayList<>();
        Builder b = defaults();
        try {
            String v;
            if ((v = get.apply("data.dir")) != null) b.dataDir(Path.of(v));
            if ((v = get.apply("tickers")) != null) b.tickers(Arrays.asList(v.split(",")));
            if ((v = get.apply("type")) != null) b.kinds(DataKind.parseSelection(v));
            if ((v = get.apply("period")) != null) b.period(v);
            if ((v = get.apply("interval")) != null) b.interval(FetchInterval.fromCode(v));
            if ((v = get.apply("max.items")) != null) b.maxNewsItems(Integer.parseInt(v.trim()));
            if ((v = get.apply("no.upload")) != null) b.skipRemote(Boolean.parseBoolean(v.trim()));
            if ((v = get.apply("force")) != null) b.forceFull(Boolean.parseBoolean(v.trim()));
            if ((v = get.apply("workers")) != null) b.workers(Integer.parseInt(v.trim()));
            if ((v = get.apply("retry.attempts")) != null) b.retryAttempts(Integer.parseInt(v.trim()));
            if ((v = get.apply("retry.delay.ms")) != null) b.retryBaseDelay(Duration.ofMillis(Long.parseLong(v.trim())));
            if ((v = get.apply("retry.multiplier")) != null) b.retryMultiplier(Double.parseDouble(v.trim()));
            if ((v = get.apply("retry.max.delay.ms")) != null) b.retryMaxDelay(Duration.ofMillis(Long.parseLong(v.trim())));
            if ((v = get.apply("qps")) != null) b.providerQps(Long.parseLong(v.trim()));
            if ((v = get.apply("backfill.cutoff")) != null) b.backfillCutoff(LocalDate.parse(v.trim()));
            if ((v = get.apply("require.initial.fetch")) != null) b.requireInitialFetch(Boolean.parseBoolean(v.trim()));
            if ((v = get.apply("remote.scope")) != null) b.remoteScope(SyncScope.parse(v));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            problems.add(e.getMessage());
        }
        if (!problems.isEmpty()) throw new ConfigurationException(problems);
        return b.build();
    }

    public static Builder defaults() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .dataDir(dataDir).tickers(tickers).kinds(kinds).period(period).interval(interval)
                .maxNewsItems(maxNewsItems).skipRemote(skipRemote).forceFull(forceFull).workers(workers)
                .retryAttempts(retryAttempts).retryBaseDelay(retryBaseDelay).retryMultiplier(retryMultiplier)
                .retryMaxDelay(retryMaxDelay).providerQps(providerQps).backfillCutoff(backfillCutoff)
                .requireInitialFetch(requireInitialFetch).remoteScope(remoteScope);
    }

    /** Checks value ranges; does not look at the filesystem or the network. */
    public SyncConfig validate() {
        List<String> problems = new ArrayList<>();
        if (kinds.isEmpty()) problems.add("no data kind selected");
        if (period == null || period.isBlank()) problems.add("full-fetch period is empty");
        if (maxNewsItems < 1) problems.add("max news items must be >= 1, got " + maxNewsItems);
        if (workers < 1) problems.add("workers must be >= 1, got " + workers);
        if (retryAttempts < 1) problems.add("retry attempts must be >= 1, got " + retryAttempts);
        if (retryBaseDelay.isNegative()) problems.add("retry delay must not be negative");
        if (retryMultiplier < 1.0) problems.add("retry multiplier must be >= 1, got " + retryMultiplier);
        if (retryMaxDelay.compareTo(retryBaseDelay) < 0) problems.add("retry max delay is below the base delay");
        if (providerQps < 0) problems.add("provider qps must not be negative");
        if (!problems.isEmpty()) throw new ConfigurationException(problems);
        return this;
    }

    public static final class Builder {
        private Path dataDir = Path.of("./data");
        private List<String> tickers = List.of();
        private Set<DataKind> kinds = Set.of(DataKind.values());
        private String period = "max";
        private FetchInterval interval = FetchInterval.DAILY;
        private int maxNewsItems = 10;
        private boolean skipRemote = false;
        private boolean forceFull = false;
        private int workers = 3;
        private int retryAttempts = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(2);
        private double retryMultiplier = 2.0;
        private Duration retryMaxDelay = Duration.ofSeconds(60);
        private long providerQps = 2;
        private LocalDate backfillCutoff = LocalDate.of(2000, 1, 1);
        private boolean requireInitialFetch = true;
        private SyncScope remoteScope = SyncScope.DATASET;

        private Builder() {}

        public Builder dataDir(Path v) { this.dataDir = v; return this; }
        public Builder tickers(List<String> v) { this.tickers = v; return this; }
        public Builder kinds(Set<DataKind> v) { this.kinds = v; return this; }
        public Builder period(String v) { this.period = v; return this; }
        public Builder interval(FetchInterval v) { this.interval = v; return this; }
        public Builder maxNewsItems(int v) { this.maxNewsItems = v; return this; }
        public Builder skipRemote(boolean v) { this.skipRemote = v; return this; }
        public Builder forceFull(boolean v) { this.forceFull = v; return this; }
        public Builder workers(int v) { this.workers = v; return this; }
        public Builder retryAttempts(int v) { this.retryAttempts = v; return this; }
        public Builder retryBaseDelay(Duration v) { this.retryBaseDelay = v; return this; }
        public Builder retryMultiplier(double v) { this.retryMultiplier = v; return this; }
        public Builder retryMaxDelay(Duration v) { this.retryMaxDelay = v; return this; }
        public Builder providerQps(long v) { this.providerQps = v; return this; }
        public Builder backfillCutoff(LocalDate v) { this.backfillCutoff = v; return this; }
        public Builder requireInitialFetch(boolean v) { this.requireInitialFetch = v; return this; }
        public Builder remoteScope(SyncScope v) { this.remoteScope = v; return this; }

        public SyncConfig build() {
            return new SyncConfig(dataDir, tickers, kinds, period, interval, maxNewsItems, skipRemote, forceFull,
                    workers, retryAttempts, retryBaseDelay, retryMultiplier, retryMaxDelay, providerQps,
                    backfillCutoff, requireInitialFetch, remoteScope);
        }
    }
}
