package io.marketsync.market.warehouse;

import io.marketsync.market.model.NewsItem;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

public class NewsTable implements WarehouseTable<NewsItem> {
    public static final String DEFAULT_NAME = "STOCK_NEWS";

    private final TableSchema schema;

    public NewsTable() {
        this(DEFAULT_NAME);
    }

    public NewsTable(String tableName) {
        this.schema = new TableSchema(tableName, List.of(
                ColumnDef.varchar(TICKER_COLUMN, 10),
                ColumnDef.varchar("ID", 50),
                ColumnDef.varchar("TITLE", 1000),
                ColumnDef.of("SUMMARY", ColumnType.STRING),
                ColumnDef.of("DESCRIPTION", ColumnType.STRING),
                ColumnDef.varchar("PUBLISHER", 100),
                ColumnDef.varchar("LINK", 2000),
                ColumnDef.of("PUBLISH_TIME", ColumnType.TIMESTAMP),
                ColumnDef.of("DISPLAY_TIME", ColumnType.TIMESTAMP),
                ColumnDef.varchar("CONTENT_TYPE", 50),
                ColumnDef.varchar("THUMBNAIL_URL", 2000),
                ColumnDef.of("IS_PREMIUM", ColumnType.BOOLEAN),
                ColumnDef.of("IS_HOSTED", ColumnType.BOOLEAN),
                ColumnDef.of("DOWNLOAD_TIMESTAMP", ColumnType.TIMESTAMP)),
                List.of(TICKER_COLUMN, "ID"));
    }

    @Override
    public TableSchema schema() { return schema; }

    @Override
    public Object key(NewsItem item) { return item.key(); }

    @Override
    public Object[] toRow(NewsItem n, Instant downloadedAt) {
        return new Object[] {n.ticker(), n.id(), n.title(), n.summary(), n.description(), n.publisher(), n.link(),
                n.publishTime(), n.displayTime(), n.contentType(), n.thumbnailUrl(), n.premium(), n.hosted(),
                downloadedAt};
    }

    @Override
    public NewsItem fromRow(ResultSet rs) throws SQLException {
        return new NewsItem(rs.getString(TICKER_COLUMN), rs.getString("ID"), rs.getString("TITLE"),
                rs.getString("SUMMARY"), rs.getString("DESCRIPTION"), rs.getString("PUBLISHER"),
                rs.getString("LINK"), instant(rs.getTimestamp("PUBLISH_TIME")),
                instant(rs.getTimestamp("DISPLAY_TIME")), rs.getString("CONTENT_TYPE"),
                rs.getString("THUMBNAIL_URL"), rs.getBoolean("IS_PREMIUM"), rs.getBoolean("IS_HOSTED"));
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
