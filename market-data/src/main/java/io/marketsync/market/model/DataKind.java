package io.marketsync.market.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Kind of dataset kept per ticker. The directory name doubles as the local file prefix.
 */
public enum DataKind {
    PRICE_HISTORY("price-history"),
    NEWS("news");

    private final String dirName;

    DataKind(String dirName) {
        this.dirName = dirName;
    }

    public String dirName() { return dirName; }

    /** Parses the command-line selector {@code price|news|all}. */
    public static Set<DataKind> parseSelection(String value) {
        String v = value == null ? "all" : value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "price", "price-history" -> EnumSet.of(PRICE_HISTORY);
            case "news" -> EnumSet.of(NEWS);
            case "all", "" -> EnumSet.allOf(DataKind.class);
            default -> throw new IllegalArgumentException("unknown data kind: " + value + " (expected price|news|all)");
        };
    }
}
