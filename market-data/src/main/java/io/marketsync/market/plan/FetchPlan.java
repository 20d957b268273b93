package io.marketsync.market.plan;

import java.time.LocalDate;
import java.util.Objects;

/**
 * What to ask the provider for. {@code FETCH_RANGE} covers {@code [start, end)}.
 */
public record FetchPlan(Type type, LocalDate start, LocalDate end, String reason) {
    public enum Type { SKIP, FETCH_RANGE, FETCH_FULL }

    public FetchPlan {
        Objects.requireNonNull(type, "type");
        if (type == Type.FETCH_RANGE && (start == null || end == null || !start.isBefore(end))) {
            throw new IllegalArgumentException("range fetch needs start < end, got " + start + ".." + end);
        }
    }

    public static FetchPlan skip(String reason) {
        return new FetchPlan(Type.SKIP, null, null, reason);
    }

    public static FetchPlan range(LocalDate start, LocalDate end) {
        return new FetchPlan(Type.FETCH_RANGE, start, end, "incremental from " + start);
    }

    public static FetchPlan full(String reason) {
        return new FetchPlan(Type.FETCH_FULL, null, null, reason);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SKIP -> "Skip(" + reason + ")";
            case FETCH_RANGE -> "FetchRange(" + start + ".." + end + ")";
            case FETCH_FULL -> "FetchFull(" + reason + ")";
        };
    }
}
