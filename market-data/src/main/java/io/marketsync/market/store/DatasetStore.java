package io.marketsync.market.store;

import io.marketsync.market.error.LocalStoreException;
import io.marketsync.market.model.DataKind;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable per-ticker dataset of one kind. A dataset is always replaced as a whole; readers see either the
 * previous or the new content, never a mix.
 */
public interface DatasetStore<R> {

    DataKind kind();

    Path pathFor(String ticker);

    boolean exists(String ticker);

    /** Empty when the ticker has never been stored. */
    List<R> load(String ticker) throws LocalStoreException;

    void replace(String ticker, List<R> records) throws LocalStoreException;

    /** Tickers that currently have a dataset, sorted. */
    List<String> tickers() throws LocalStoreException;
}
