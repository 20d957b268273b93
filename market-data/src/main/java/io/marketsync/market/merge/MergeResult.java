package io.marketsync.market.merge;

import java.util.List;

/**
 * @param records           merged, de-duplicated and ordered dataset
 * @param before            records held before the merge
 * @param fetched           records offered by the fetch
 * @param added             keys that were not present before
 * @param duplicatesRemoved rows dropped because a later row carried the same key
 */
public record MergeResult<R>(List<R> records, int before, int fetched, int added, int duplicatesRemoved) {

    public MergeResult {
        records = List.copyOf(records);
    }

    public int total() { return records.size(); }
}
