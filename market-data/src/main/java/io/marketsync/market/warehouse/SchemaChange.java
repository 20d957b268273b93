package io.marketsync.market.warehouse;

import java.util.List;

/**
 * DDL the schema check may apply. Rendered to SQL by {@link SqlDialect#render}.
 */
public interface SchemaChange {

    record CreateTable(TableSchema schema) implements SchemaChange {}

    record AddColumns(String table, List<ColumnDef> columns) implements SchemaChange {
        public AddColumns {
            columns = List.copyOf(columns);
        }
    }

    record DropTable(String table) implements SchemaChange {}
}
