package io.marketsync.market.fetch;

import io.marketsync.market.model.FetchInterval;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Either a full-history request ({@code period} set, no dates) or an explicit window
 * {@code [start, end)} with {@code end} exclusive.
 */
public record SeriesRequest(String ticker, LocalDate start, LocalDate end, String period, FetchInterval interval) {

    public SeriesRequest {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(interval, "interval");
        if (period == null && (start == null || end == null)) {
            throw new IllegalArgumentException("either a period or a start/end window is required");
        }
    }

    public static SeriesRequest full(String ticker, String period, FetchInterval interval) {
        return new SeriesRequest(ticker, null, null, Objects.requireNonNull(period, "period"), interval);
    }

    public static SeriesRequest window(String ticker, LocalDate start, LocalDate end, FetchInterval interval) {
        return new SeriesRequest(ticker, start, end, null, interval);
    }

    public boolean isFullHistory() { return period != null; }

    @Override
    public String toString() {
        return ticker + (isFullHistory() ? " period=" + period : " " + start + ".." + end) + " interval=" + interval.code();
    }
}
