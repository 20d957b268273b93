package io.marketsync.market.warehouse;

import io.marketsync.market.model.PriceBar;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

public class PriceHistoryTable implements WarehouseTable<PriceBar> {
    public static final String DEFAULT_NAME = "STOCK_PRICE_HISTORY";

    private final TableSchema schema;

    public PriceHistoryTable() {
        this(DEFAULT_NAME);
    }

    public PriceHistoryTable(String tableName) {
        this.schema = new TableSchema(tableName, List.of(
                ColumnDef.varchar(TICKER_COLUMN, 10),
                ColumnDef.of("DATE", ColumnType.DATE),
                ColumnDef.of("OPEN", ColumnType.DOUBLE),
                ColumnDef.of("HIGH", ColumnType.DOUBLE),
                ColumnDef.of("LOW", ColumnType.DOUBLE),
                ColumnDef.of("CLOSE", ColumnType.DOUBLE),
                ColumnDef.of("ADJ_CLOSE", ColumnType.DOUBLE),
                ColumnDef.of("VOLUME", ColumnType.BIGINT),
                ColumnDef.of("DOWNLOAD_TIMESTAMP", ColumnType.TIMESTAMP)),
                List.of(TICKER_COLUMN, "DATE"));
    }

    @Override
    public TableSchema schema() { return schema; }

    @Override
    public Object key(PriceBar bar) { return bar.key(); }

    @Override
    public Object[] toRow(PriceBar b, Instant downloadedAt) {
        return new Object[] {b.ticker(), b.date(), b.open(), b.high(), b.low(), b.close(), b.adjClose(),
                b.volume(), downloadedAt};
    }

    @Override
    public PriceBar fromRow(ResultSet rs) throws SQLException {
        long volume = rs.getLong("VOLUME");
        Long vol = rs.wasNull() ? null : volume;
        return new PriceBar(rs.getString(TICKER_COLUMN), rs.getDate("DATE").toLocalDate(),
                dbl(rs, "OPEN"), dbl(rs, "HIGH"), dbl(rs, "LOW"), dbl(rs, "CLOSE"), dbl(rs, "ADJ_CLOSE"), vol);
    }

    private static Double dbl(ResultSet rs, String column) throws SQLException {
        double d = rs.getDouble(column);
        return rs.wasNull() ? null : d;
    }
}
