package io.marketsync.market.store;

import io.marketsync.market.error.LocalStoreException;
import io.marketsync.market.model.DataKind;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CSV-backed {@link DatasetStore}. Layout: {@code <base>/<kind>/<TICKER>/<kind>-<TICKER>.csv}.
 * Replacement writes a temp file next to the target and renames it over the old one.
 */
public class CsvDatasetStore<R> implements DatasetStore<R> {
    private static final Logger log = LoggerFactory.getLogger(CsvDatasetStore.class);

    private final Path baseDir;
    private final DataKind kind;
    private final CsvCodec<R> codec;

    public CsvDatasetStore(Path baseDir, DataKind kind, CsvCodec<R> codec) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public static CsvDatasetStore<PriceBar> prices(Path baseDir) {
        return new CsvDatasetStore<>(baseDir, DataKind.PRICE_HISTORY, new PriceCsvCodec());
    }

    public static CsvDatasetStore<NewsItem> news(Path baseDir) {
        return new CsvDatasetStore<>(baseDir, DataKind.NEWS, new NewsCsvCodec());
    }

    @Override
    public DataKind kind() { return kind; }

    @Override
    public Path pathFor(String ticker) {
        return kindDir().resolve(ticker).resolve(kind.dirName() + "-" + ticker + ".csv");
    }

    @Override
    public boolean exists(String ticker) {
        return Files.isRegularFile(pathFor(ticker));
    }

    @Override
    public List<R> load(String ticker) throws LocalStoreException {
        Path path = pathFor(ticker);
        if (!Files.exists(path)) return new ArrayList<>();
        List<List<String>> rows;
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            rows = Csv.parse(br);
        } catch (IOException e) {
            throw LocalStoreException.read(path, "cannot read dataset", e);
        }
        if (rows.isEmpty()) return new ArrayList<>();
        if (!codec.header().equals(rows.get(0))) {
            throw LocalStoreException.read(path, "unexpected header " + rows.get(0), null);
        }
        List<R> out = new ArrayList<>(rows.size() - 1);
        int width = codec.header().size();
        for (int i = 1; i < rows.size(); i++) {
            List<String> cells = rows.get(i);
            if (cells.size() != width) {
                throw LocalStoreException.read(path, "row " + i + " has " + cells.size() + " cells, expected " + width, null);
            }
            try {
                out.add(codec.decode(cells));
            } catch (RuntimeException e) {
                throw LocalStoreException.read(path, "row " + i + " is malformed", e);
            }
        }
        return out;
    }

    @Override
    public void replace(String ticker, List<R> records) throws LocalStoreException {
        Path target = pathFor(ticker);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(Csv.formatRow(codec.header()));
                for (R r : records) w.write(Csv.formatRow(codec.encode(r)));
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
            log.debug("{} {}: wrote {} records to {}", kind.dirName(), ticker, records.size(), target);
        } catch (IOException e) {
            throw LocalStoreException.write(target, "cannot replace dataset", e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("could not remove temp file {}: {}", tmp, e.toString());
                }
            }
        }
    }

    @Override
    public List<String> tickers() throws LocalStoreException {
        Path dir = kindDir();
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path p : ds) {
                String ticker = p.getFileName().toString();
                if (exists(ticker)) out.add(ticker);
            }
        } catch (IOException e) {
            throw LocalStoreException.read(dir, "cannot list datasets", e);
        }
        out.sort(null);
        return out;
    }

    private Path kindDir() {
        return baseDir.resolve(kind.dirName());
    }
}
