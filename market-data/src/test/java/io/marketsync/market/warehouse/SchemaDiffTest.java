package io.marketsync.market.warehouse;

import org.junit.jupiter.api.Test;

import java.sql.Types;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaDiffTest {
    private final TableSchema schema = new PriceHistoryTable().schema();

    private static List<ActualColumn> actual(Object... nameTypePairs) {
        java.util.ArrayList<ActualColumn> out = new java.util.ArrayList<>();
        for (int i = 0; i < nameTypePairs.length; i += 2) {
            out.add(new ActualColumn((String) nameTypePairs[i], (Integer) nameTypePairs[i + 1], "T"));
        }
        return out;
    }

    @Test
    void matchingTableHasNoDiff() {
        SchemaDiff diff = SchemaDiff.between(schema, actual(
                "TICKER", Types.VARCHAR, "DATE", Types.DATE, "OPEN", Types.DOUBLE, "HIGH", Types.DOUBLE,
                "LOW", Types.DOUBLE, "CLOSE", Types.DOUBLE, "ADJ_CLOSE", Types.DOUBLE, "VOLUME", Types.BIGINT,
                "DOWNLOAD_TIMESTAMP", Types.TIMESTAMP, "EXTRA", Types.INTEGER));
        assertTrue(diff.isEmpty());
    }

    @Test
    void lengthAndFlavourVariantsAreCompatible() {
        // NUMBER(38,0) reported as DECIMAL, TIMESTAMP_TZ, CHAR for a string column
        SchemaDiff diff = SchemaDiff.between(schema, actual(
                "TICKER", Types.CHAR, "DATE", Types.DATE, "OPEN", Types.FLOAT, "HIGH", Types.REAL,
                "LOW", Types.NUMERIC, "CLOSE", Types.DECIMAL, "ADJ_CLOSE", Types.DOUBLE, "VOLUME", Types.DECIMAL,
                "DOWNLOAD_TIMESTAMP", Types.TIMESTAMP_WITH_TIMEZONE));
        assertTrue(diff.isEmpty());
    }

    @Test
    void reportsMissingAndIncompatibleColumns() {
        SchemaDiff diff = SchemaDiff.between(schema, actual(
                "ticker", Types.VARCHAR, "DATE", Types.VARCHAR, "OPEN", Types.DOUBLE, "HIGH", Types.DOUBLE,
                "LOW", Types.DOUBLE, "CLOSE", Types.BOOLEAN, "VOLUME", Types.BIGINT));

        assertEquals(List.of("ADJ_CLOSE", "DOWNLOAD_TIMESTAMP"), diff.missing().stream().map(ColumnDef::name).toList());
        assertEquals(List.of("DATE", "CLOSE"), diff.incompatible().stream().map(m -> m.declared().name()).toList());
    }
}
