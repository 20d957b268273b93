package io.marketsync.market.warehouse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Difference between a declared schema and the columns a table actually has. Extra columns on the table
 * are ignored.
 */
public record SchemaDiff(List<ColumnDef> missing, List<Mismatch> incompatible) {

    public record Mismatch(ColumnDef declared, ActualColumn actual) {
        @Override
        public String toString() {
            return declared.name() + " declared " + declared.ddlType() + " but is " + actual.typeName();
        }
    }

    public SchemaDiff {
        missing = List.copyOf(missing);
        incompatible = List.copyOf(incompatible);
    }

    public static SchemaDiff between(TableSchema declared, List<ActualColumn> actual) {
        Map<String, ActualColumn> byName = new HashMap<>();
        for (ActualColumn a : actual) byName.put(a.name().toUpperCase(Locale.ROOT), a);
        List<ColumnDef> missing = new ArrayList<>();
        List<Mismatch> incompatible = new ArrayList<>();
        for (ColumnDef c : declared.columns()) {
            ActualColumn a = byName.get(c.name());
            if (a == null) {
                missing.add(c);
            } else if (!c.type().accepts(a.jdbcType())) {
                incompatible.add(new Mismatch(c, a));
            }
        }
        return new SchemaDiff(missing, incompatible);
    }

    public boolean isEmpty() { return missing.isEmpty() && incompatible.isEmpty(); }
}
