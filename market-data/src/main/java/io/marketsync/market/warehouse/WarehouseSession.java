package io.marketsync.market.warehouse;

import java.sql.SQLException;
import java.util.List;

/**
 * One connection's worth of warehouse operations, opened per sync call and closed when it ends.
 */
public interface WarehouseSession extends AutoCloseable {

    boolean tableExists(String table) throws SQLException;

    /** Columns of {@code table} in ordinal order. */
    List<ActualColumn> describeTable(String table) throws SQLException;

    long countRows(String table) throws SQLException;

    long countRows(String table, String column, String value) throws SQLException;

    void applySchemaChange(SchemaChange change) throws SQLException;

    /** Creates an empty staging table shaped like {@code schema} and returns its name. */
    String createStaging(TableSchema schema) throws SQLException;

    /** Inserts rows whose values follow {@code schema}'s column order. Returns the rows submitted. */
    int writeStaging(String staging, TableSchema schema, List<Object[]> rows) throws SQLException;

    /** Upserts every staged row into {@code schema}'s table in a single transaction. */
    void mergeStaging(String staging, TableSchema schema) throws SQLException;

    void dropTable(String table) throws SQLException;

    @Override
    void close() throws SQLException;
}
