package io.marketsync.market.store;

import io.marketsync.market.TestData;
import io.marketsync.market.error.FailureKind;
import io.marketsync.market.error.LocalStoreException;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvDatasetStoreTest {
    @TempDir
    Path dir;

    @Test
    void missingDatasetLoadsEmpty() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        assertFalse(store.exists("AAPL"));
        assertTrue(store.load("AAPL").isEmpty());
    }

    @Test
    void priceDatasetLayoutAndHeader() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        List<PriceBar> bars = List.of(
                TestData.bar("AAPL", LocalDate.of(2024, 1, 2), 185.5),
                new PriceBar("AAPL", LocalDate.of(2024, 1, 3), null, null, null, 184.25, null, null));

        store.replace("AAPL", bars);

        Path file = dir.resolve("price-history").resolve("AAPL").resolve("price-history-AAPL.csv");
        assertEquals(file, store.pathFor("AAPL"));
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals("TICKER,DATE,OPEN,HIGH,LOW,CLOSE,ADJ_CLOSE,VOLUME", lines.get(0));
        assertEquals("AAPL,2024-01-03,,,,184.25,,", lines.get(2));
        assertEquals(bars, store.load("AAPL"));
    }

    @Test
    void newsTextWithCommasQuotesAndNewlinesSurvives() throws Exception {
        CsvDatasetStore<NewsItem> store = CsvDatasetStore.news(dir);
        NewsItem tricky = new NewsItem("MSFT", "id-1", "Earnings, \"beat\" again", "line one\nline two", null,
                "Pub", "https://x/y?a=1,2", Instant.parse("2024-03-01T10:15:30Z"), null, "STORY",
                "https://img/1.jpg", true, false);

        store.replace("MSFT", List.of(tricky, TestData.news("MSFT", "id-2", null)));

        assertEquals(List.of(tricky, TestData.news("MSFT", "id-2", null)), store.load("MSFT"));
        assertTrue(Files.readString(store.pathFor("MSFT")).startsWith(
                "TICKER,ID,TITLE,SUMMARY,DESCRIPTION,PUBLISHER,LINK,PUBLISH_TIME,DISPLAY_TIME,CONTENT_TYPE,THUMBNAIL_URL,IS_PREMIUM,IS_HOSTED\n"));
    }

    @Test
    void missingNewsTextIsWrittenAsEmptyCellsAndReadBackAsNull() throws Exception {
        CsvDatasetStore<NewsItem> store = CsvDatasetStore.news(dir);
        NewsItem bare = new NewsItem("MSFT", "id-3", null, null, null, null, null, null, null, null, null,
                false, false);

        store.replace("MSFT", List.of(bare));

        assertEquals("MSFT,id-3,,,,,,,,,,false,false",
                Files.readAllLines(store.pathFor("MSFT"), StandardCharsets.UTF_8).get(1));
        NewsItem loaded = store.load("MSFT").get(0);
        assertNull(loaded.title());
        assertNull(loaded.thumbnailUrl());
        assertEquals(bare, loaded);
    }

    @Test
    void replaceOverwritesWholeDatasetAndLeavesNoTempFiles() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        store.replace("SPY", TestData.bars("SPY", LocalDate.of(2024, 1, 1), 5));
        store.replace("SPY", TestData.bars("SPY", LocalDate.of(2024, 2, 1), 2));

        assertEquals(2, store.load("SPY").size());
        try (Stream<Path> files = Files.list(store.pathFor("SPY").getParent())) {
            assertEquals(List.of(store.pathFor("SPY")), files.toList());
        }
    }

    @Test
    void unexpectedHeaderIsALocalReadError() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        Files.createDirectories(store.pathFor("BAD").getParent());
        Files.writeString(store.pathFor("BAD"), "date,open,high,low,close,volume\n2024-01-01,1,1,1,1,100\n");

        LocalStoreException e = assertThrows(LocalStoreException.class, () -> store.load("BAD"));
        assertEquals(FailureKind.LOCAL_READ, e.kind());
    }

    @Test
    void malformedCellIsALocalReadError() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        Files.createDirectories(store.pathFor("BAD").getParent());
        Files.writeString(store.pathFor("BAD"),
                "TICKER,DATE,OPEN,HIGH,LOW,CLOSE,ADJ_CLOSE,VOLUME\nBAD,not-a-date,1,1,1,1,1,1\n");

        assertEquals(FailureKind.LOCAL_READ, assertThrows(LocalStoreException.class, () -> store.load("BAD")).kind());
    }

    @Test
    void unwritableLocationIsALocalWriteError() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        // a plain file where the ticker directory should be
        Files.createDirectories(dir.resolve("price-history"));
        Files.writeString(dir.resolve("price-history").resolve("XYZ"), "not a directory");

        LocalStoreException e = assertThrows(LocalStoreException.class,
                () -> store.replace("XYZ", TestData.bars("XYZ", LocalDate.of(2024, 1, 1), 1)));
        assertEquals(FailureKind.LOCAL_WRITE, e.kind());
    }

    @Test
    void listsStoredTickers() throws Exception {
        CsvDatasetStore<PriceBar> store = CsvDatasetStore.prices(dir);
        store.replace("MSFT", TestData.bars("MSFT", LocalDate.of(2024, 1, 1), 1));
        store.replace("AAPL", TestData.bars("AAPL", LocalDate.of(2024, 1, 1), 1));
        Files.createDirectories(dir.resolve("price-history").resolve("EMPTY"));

        assertEquals(List.of("AAPL", "MSFT"), store.tickers());
    }
}
