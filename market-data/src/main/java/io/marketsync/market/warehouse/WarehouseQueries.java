package io.marketsync.market.warehouse;

import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the warehouse tables, newest rows first.
 */
public class WarehouseQueries {
    private final JdbcWarehouseSessionFactory connections;
    private final PriceHistoryTable prices;
    private final NewsTable news;

    public WarehouseQueries(JdbcWarehouseSessionFactory connections, PriceHistoryTable prices, NewsTable news) {
        this.connections = connections;
        this.prices = prices;
        this.news = news;
    }

    /** @param from inclusive, may be null; @param to inclusive, may be null */
    public List<PriceBar> priceHistory(String ticker, LocalDate from, LocalDate to) throws SQLException {
        SqlDialect d = connections.dialect();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(d.quote(prices.schema().table()))
                .append(" WHERE ").append(d.quote(WarehouseTable.TICKER_COLUMN)).append(" = ?");
        if (from != null) sql.append(" AND ").append(d.quote("DATE")).append(" >= ?");
        if (to != null) sql.append(" AND ").append(d.quote("DATE")).append(" <= ?");
        sql.append(" ORDER BY ").append(d.quote("DATE")).append(" DESC");

        try (Connection c = connections.connect();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, ticker);
            if (from != null) ps.setDate(i++, Date.valueOf(from));
            if (to != null) ps.setDate(i, Date.valueOf(to));
            return read(ps, prices);
        }
    }

    public List<NewsItem> news(String ticker, int limit) throws SQLException {
        SqlDialect d = connections.dialect();
        String sql = "SELECT * FROM " + d.quote(news.schema().table())
                + " WHERE " + d.quote(WarehouseTable.TICKER_COLUMN) + " = ?"
                + " ORDER BY " + d.quote("PUBLISH_TIME") + " DESC NULLS LAST"
                + " LIMIT " + Math.max(0, limit);
        try (Connection c = connections.connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ticker);
            return read(ps, news);
        }
    }

    private static <R> List<R> read(PreparedStatement ps, WarehouseTable<R> table) throws SQLException {
        List<R> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(table.fromRow(rs));
        }
        return out;
    }
}
