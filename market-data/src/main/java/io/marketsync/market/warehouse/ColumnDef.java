package io.marketsync.market.warehouse;

import java.util.Locale;
import java.util.Objects;

/**
 * @param length only meaningful for {@link ColumnType#STRING}; null means unbounded
 */
public record ColumnDef(String name, ColumnType type, Integer length) {

    public ColumnDef {
        name = Objects.requireNonNull(name, "name").toUpperCase(Locale.ROOT);
        Objects.requireNonNull(type, "type");
    }

    public static ColumnDef of(String name, ColumnType type) {
        return new ColumnDef(name, type, null);
    }

    public static ColumnDef varchar(String name, int length) {
        return new ColumnDef(name, ColumnType.STRING, length);
    }

    public String ddlType() { return type.ddl(length); }
}
