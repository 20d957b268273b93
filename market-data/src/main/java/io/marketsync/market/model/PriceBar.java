package io.marketsync.market.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One time-series row. Unique per (ticker, date); any price field or the volume may be missing.
 */
public record PriceBar(String ticker,
                       LocalDate date,
                       Double open,
                       Double high,
                       Double low,
                       Double close,
                       Double adjClose,
                       Long volume) {

    public PriceBar {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(date, "date");
    }

    public Key key() { return new Key(ticker, date); }

    public record Key(String ticker, LocalDate date) {}
}
