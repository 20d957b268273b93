package io.marketsync.market.store;

import java.util.List;

/**
 * Column layout of one dataset kind. Empty cells stand for missing values.
 */
public interface CsvCodec<R> {

    List<String> header();

    List<String> encode(R record);

    /** @throws IllegalArgumentException when a cell cannot be parsed */
    R decode(List<String> cells);
}
