package io.marketsync.market.warehouse;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Binds a record type to its warehouse table: declared schema, row values in column order, and the
 * mapping back from a query result.
 */
public interface WarehouseTable<R> {
    String TICKER_COLUMN = "TICKER";

    TableSchema schema();

    /** Natural key of the record; equal keys collapse to one row. */
    Object key(R record);

    Object[] toRow(R record, Instant downloadedAt);

    R fromRow(ResultSet rs) throws SQLException;
}
