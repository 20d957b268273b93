package io.marketsync.market.model;

import java.time.LocalDate;
import java.time.Period;
import java.util.Locale;

/**
 * Bar size of a price series, with the provider code and the calendar step between consecutive bars.
 */
public enum FetchInterval {
    DAILY("1d", Period.ofDays(1)),
    WEEKLY("1wk", Period.ofWeeks(1)),
    MONTHLY("1mo", Period.ofMonths(1));

    private final String code;
    private final Period step;

    FetchInterval(String code, Period step) {
        this.code = code;
        this.step = step;
    }

    public String code() { return code; }

    /** The first date after {@code last} that can hold a new bar. */
    public LocalDate next(LocalDate last) {
        return last.plus(step);
    }

    public static FetchInterval fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (FetchInterval i : values()) {
            if (i.code.equals(c)) return i;
        }
        throw new IllegalArgumentException("unsupported interval: " + code + " (expected 1d|1wk|1mo)");
    }
}
