package io.marketsync.market.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link WarehouseSession} over a single JDBC connection, which it owns and closes.
 */
public class JdbcWarehouseSession implements WarehouseSession {
    private static final Logger log = LoggerFactory.getLogger(JdbcWarehouseSession.class);
    private static final int BATCH_SIZE = 1_000;

    private final Connection connection;
    private final SqlDialect dialect;

    public JdbcWarehouseSession(Connection connection, SqlDialect dialect) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    @Override
    public boolean tableExists(String table) throws SQLException {
        DatabaseMetaData md = connection.getMetaData();
        try (ResultSet rs = md.getTables(connection.getCatalog(), connection.getSchema(), pattern(md, table), null)) {
            while (rs.next()) {
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) return true;
            }
        }
        return false;
    }

    @Override
    public List<ActualColumn> describeTable(String table) throws SQLException {
        DatabaseMetaData md = connection.getMetaData();
        List<ActualColumn> out = new ArrayList<>();
        try (ResultSet rs = md.getColumns(connection.getCatalog(), connection.getSchema(), pattern(md, table), null)) {
            while (rs.next()) {
                if (!table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) continue;
                out.add(new ActualColumn(rs.getString("COLUMN_NAME"), rs.getInt("DATA_TYPE"), rs.getString("TYPE_NAME")));
            }
        }
        return out;
    }

    @Override
    public long countRows(String table) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(dialect.count(table, null))) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public long countRows(String table, String column, String value) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(dialect.count(table, column))) {
            ps.setString(1, value);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public void applySchemaChange(SchemaChange change) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : dialect.render(change)) {
                log.debug("schema change: {}", sql);
                st.execute(sql);
            }
        }
    }

    @Override
    public String createStaging(TableSchema schema) throws SQLException {
        String staging = schema.table() + "_STAGING_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
        try (Statement st = connection.createStatement()) {
            st.execute(dialect.createStaging(staging, schema));
        }
        return staging;
    }

    @Override
    public int writeStaging(String staging, TableSchema schema, List<Object[]> rows) throws SQLException {
        if (rows.isEmpty()) return 0;
        List<ColumnDef> cols = schema.columns();
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (PreparedStatement ps = connection.prepareStatement(dialect.insert(staging, schema))) {
            int pending = 0;
            for (Object[] row : rows) {
                for (int i = 0; i < cols.size(); i++) {
                    bind(ps, i + 1, cols.get(i).type(), row[i]);
                }
                ps.addBatch();
                if (++pending == BATCH_SIZE) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) ps.executeBatch();
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
        return rows.size();
    }

    @Override
    public void mergeStaging(String staging, TableSchema schema) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (Statement st = connection.createStatement()) {
            st.executeUpdate(dialect.merge(staging, schema));
            connection.commit();
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    @Override
    public void dropTable(String table) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(dialect.dropTable(table));
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private static String pattern(DatabaseMetaData md, String name) throws SQLException {
        String esc = md.getSearchStringEscape();
        if (esc == null || esc.isEmpty()) return name;
        return name.replace(esc, esc + esc).replace("_", esc + "_").replace("%", esc + "%");
    }

    private static void bind(PreparedStatement ps, int idx, ColumnType type, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, type.jdbcType());
            return;
        }
        switch (type) {
            case STRING -> ps.setString(idx, value.toString());
            case DOUBLE -> ps.setDouble(idx, ((Number) value).doubleValue());
            case BIGINT -> ps.setLong(idx, ((Number) value).longValue());
            case DATE -> ps.setDate(idx, Date.valueOf((LocalDate) value));
            case TIMESTAMP -> ps.setTimestamp(idx, Timestamp.from((Instant) value));
            case BOOLEAN -> ps.setBoolean(idx, (Boolean) value);
        }
    }
}
