package io.marketsync.market.pipeline;

import java.util.List;

/**
 * Fetch step of a ticker pipeline: decides what to ask for given the stored records and asks for it.
 */
public interface DatasetFetcher<R> {

    FetchResult<R> fetch(String ticker, List<R> stored, boolean forceFull) throws InterruptedException;
}
