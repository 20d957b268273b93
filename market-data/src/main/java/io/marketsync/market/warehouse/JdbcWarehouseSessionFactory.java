package io.marketsync.market.warehouse;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Opens sessions straight from {@link DriverManager}; each session gets its own connection.
 */
public class JdbcWarehouseSessionFactory implements WarehouseSessionFactory {
    private final String jdbcUrl;
    private final Properties properties;
    private final SqlDialect dialect;

    public JdbcWarehouseSessionFactory(String jdbcUrl, Properties properties) {
        this(jdbcUrl, properties, SqlDialect.forUrl(jdbcUrl));
    }

    public JdbcWarehouseSessionFactory(String jdbcUrl, Properties properties, SqlDialect dialect) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.properties = properties == null ? new Properties() : properties;
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public WarehouseSession open() throws SQLException {
        return new JdbcWarehouseSession(connect(), dialect);
    }

    public Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, properties);
    }

    public SqlDialect dialect() { return dialect; }
}
