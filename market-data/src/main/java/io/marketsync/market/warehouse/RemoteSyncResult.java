package io.marketsync.market.warehouse;

/**
 * @param submitted rows handed to the sync after de-duplication
 * @param staged    rows found in staging before the merge
 * @param before    target rows for the ticker before the merge
 * @param after     target rows for the ticker after the merge
 */
public record RemoteSyncResult(String table, int submitted, long staged, long before, long after) {

    public static RemoteSyncResult nothingToSync(String table, long current) {
        return new RemoteSyncResult(table, 0, 0, current, current);
    }

    /** Newly inserted keys. Never negative: the upsert only inserts or updates. */
    public long rowsAdded() {
        return Math.max(0, after - before);
    }
}
