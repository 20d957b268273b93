package io.marketsync.market.warehouse;

import java.sql.Types;
import java.util.Set;

/**
 * Logical column types. Compatibility with an existing column is judged by JDBC type family, so
 * {@code VARCHAR(50)} vs {@code TEXT} or {@code TIMESTAMP} vs {@code TIMESTAMP_NTZ} are not drift.
 */
public enum ColumnType {
    STRING(Types.VARCHAR, Set.of(Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.NVARCHAR, Types.NCHAR,
            Types.LONGNVARCHAR, Types.CLOB, Types.NCLOB)),
    DOUBLE(Types.DOUBLE, Set.of(Types.DOUBLE, Types.FLOAT, Types.REAL, Types.DECIMAL, Types.NUMERIC)),
    BIGINT(Types.BIGINT, Set.of(Types.BIGINT, Types.INTEGER, Types.SMALLINT, Types.TINYINT, Types.DECIMAL,
            Types.NUMERIC)),
    DATE(Types.DATE, Set.of(Types.DATE)),
    TIMESTAMP(Types.TIMESTAMP, Set.of(Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE)),
    BOOLEAN(Types.BOOLEAN, Set.of(Types.BOOLEAN, Types.BIT));

    private final int jdbcType;
    private final Set<Integer> family;

    ColumnType(int jdbcType, Set<Integer> family) {
        this.jdbcType = jdbcType;
        this.family = family;
    }

    public int jdbcType() { return jdbcType; }

    public boolean accepts(int actualJdbcType) {
        return family.contains(actualJdbcType);
    }

    String ddl(Integer length) {
        return switch (this) {
            case STRING -> length == null ? "VARCHAR" : "VARCHAR(" + length + ")";
            case DOUBLE -> "FLOAT";
            case BIGINT -> "BIGINT";
            case DATE -> "DATE";
            case TIMESTAMP -> "TIMESTAMP";
            case BOOLEAN -> "BOOLEAN";
        };
    }
}
