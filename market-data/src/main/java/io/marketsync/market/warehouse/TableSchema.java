package io.marketsync.market.warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declared layout of a warehouse table: ordered columns plus the natural key used by the upsert.
 */
public record TableSchema(String table, List<ColumnDef> columns, List<String> keyColumns) {

    public TableSchema {
        table = Objects.requireNonNull(table, "table").toUpperCase(Locale.ROOT);
        columns = List.copyOf(columns);
        keyColumns = keyColumns.stream().map(k -> k.toUpperCase(Locale.ROOT)).toList();
        for (String k : keyColumns) {
            if (columns.stream().noneMatch(c -> c.name().equals(k))) {
                throw new IllegalArgumentException("key column " + k + " is not declared in " + table);
            }
        }
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDef::name).toList();
    }

    public List<ColumnDef> nonKeyColumns() {
        List<ColumnDef> out = new ArrayList<>();
        for (ColumnDef c : columns) {
            if (!keyColumns.contains(c.name())) out.add(c);
        }
        return out;
    }
}
