package io.marketsync.market.warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * SQL text for the statements the sync needs. All identifiers are double-quoted; the declared names are
 * upper case so quoting does not change how the database resolves them.
 */
public enum SqlDialect {
    /** Snowflake: staging lives in a session-scoped temporary table. */
    SNOWFLAKE(true),
    /** Any other JDBC store with standard MERGE support (H2 in tests): staging is a plain table. */
    GENERIC(false);

    private final boolean temporaryStaging;

    SqlDialect(boolean temporaryStaging) {
        this.temporaryStaging = temporaryStaging;
    }

    public static SqlDialect forUrl(String jdbcUrl) {
        return jdbcUrl != null && jdbcUrl.toLowerCase(Locale.ROOT).startsWith("jdbc:snowflake:") ? SNOWFLAKE : GENERIC;
    }

    public String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    public List<String> render(SchemaChange change) {
        if (change instanceof SchemaChange.CreateTable c) {
            return List.of(createTable(c.schema()));
        }
        if (change instanceof SchemaChange.AddColumns a) {
            List<String> out = new ArrayList<>();
            for (ColumnDef col : a.columns()) {
                out.add("ALTER TABLE " + quote(a.table()) + " ADD COLUMN IF NOT EXISTS "
                        + quote(col.name()) + " " + col.ddlType());
            }
            return out;
        }
        if (change instanceof SchemaChange.DropTable d) {
            return List.of(dropTable(d.table()));
        }
        throw new IllegalArgumentException("unsupported schema change " + change);
    }

    String createTable(TableSchema schema) {
        StringJoiner cols = new StringJoiner(", ");
        for (ColumnDef c : schema.columns()) cols.add(quote(c.name()) + " " + c.ddlType());
        if (!schema.keyColumns().isEmpty()) {
            StringJoiner key = new StringJoiner(", ");
            for (String k : schema.keyColumns()) key.add(quote(k));
            cols.add("PRIMARY KEY (" + key + ")");
        }
        return "CREATE TABLE IF NOT EXISTS " + quote(schema.table()) + " (" + cols + ")";
    }

    String createStaging(String staging, TableSchema schema) {
        StringJoiner cols = new StringJoiner(", ");
        for (ColumnDef c : schema.columns()) cols.add(quote(c.name()) + " " + c.ddlType());
        return "CREATE " + (temporaryStaging ? "TEMPORARY " : "") + "TABLE " + quote(staging) + " (" + cols + ")";
    }

    String dropTable(String table) {
        return "DROP TABLE IF EXISTS " + quote(table);
    }

    String insert(String table, TableSchema schema) {
        StringJoiner cols = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        for (ColumnDef c : schema.columns()) {
            cols.add(quote(c.name()));
            marks.add("?");
        }
        return "INSERT INTO " + quote(table) + " (" + cols + ") VALUES (" + marks + ")";
    }

    String count(String table, String filterColumn) {
        String sql = "SELECT COUNT(*) FROM " + quote(table);
        return filterColumn == null ? sql : sql + " WHERE " + quote(filterColumn) + " = ?";
    }

    /** Upsert of every staged row into the target, matched on the schema's key columns. */
    String merge(String staging, TableSchema schema) {
        StringJoiner on = new StringJoiner(" AND ");
        for (String k : schema.keyColumns()) on.add("TGT." + quote(k) + " = SRC." + quote(k));
        StringJoiner set = new StringJoiner(", ");
        for (ColumnDef c : schema.nonKeyColumns()) set.add(quote(c.name()) + " = SRC." + quote(c.name()));
        StringJoiner cols = new StringJoiner(", ");
        StringJoiner vals = new StringJoiner(", ");
        for (ColumnDef c : schema.columns()) {
            cols.add(quote(c.name()));
            vals.add("SRC." + quote(c.name()));
        }
        return "MERGE INTO " + quote(schema.table()) + " AS TGT USING " + quote(staging) + " AS SRC ON (" + on + ")"
                + " WHEN MATCHED THEN UPDATE SET " + set
                + " WHEN NOT MATCHED THEN INSERT (" + cols + ") VALUES (" + vals + ")";
    }
}
