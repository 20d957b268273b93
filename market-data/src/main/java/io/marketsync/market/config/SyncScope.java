package io.marketsync.market.config;

import java.util.Locale;

/**
 * Which rows a remote sync pushes.
 */
public enum SyncScope {
    /** The whole merged local dataset; repairs the remote table if an earlier upload was lost. */
    DATASET,
    /** Only the rows fetched in this run. */
    BATCH;

    public static SyncScope parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
