package io.marketsync.market.warehouse;

import io.marketsync.market.error.RemoteSchemaException;
import io.marketsync.market.error.RemoteSyncException;
import io.marketsync.market.error.RemoteWriteVerificationException;
import io.marketsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Pushes one ticker's batch into a warehouse table through a staged, verified upsert:
 * <pre>
 *   SCHEMA_CHECK -> STAGE_CREATE -> STAGE_WRITE -> STAGE_VERIFY -> UPSERT -> CLEANUP
 * </pre>
 * The target is only touched by the UPSERT step, which runs in one transaction; a failure anywhere before it
 * leaves the target unchanged. Staging is dropped on every exit path.
 * <p>
 * Schema drift handling: a missing table is created; missing columns are added; incompatible column types
 * cause the table to be dropped and recreated when it is empty, and fail the sync untouched when it is not.
 */
public class WarehouseSyncEngine<R> {
    private static final Logger log = LoggerFactory.getLogger(WarehouseSyncEngine.class);

    private final WarehouseSessionFactory sessions;
    private final WarehouseTable<R> table;
    private final Clock clock;
    private final Metrics metrics;
    private final Object schemaLock = new Object();

    public WarehouseSyncEngine(WarehouseSessionFactory sessions, WarehouseTable<R> table, Clock clock, Metrics metrics) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.table = Objects.requireNonNull(table, "table");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public RemoteSyncResult sync(String ticker, List<R> batch) throws RemoteSyncException {
        return sync(ticker, batch, stage -> {});
    }

    /** @param progress told about each stage as it starts */
    public RemoteSyncResult sync(String ticker, List<R> batch, Consumer<SyncStage> progress) throws RemoteSyncException {
        TableSchema schema = table.schema();
        SyncStage stage = SyncStage.CONNECT;
        try (WarehouseSession session = sessions.open()) {
            stage = SyncStage.SCHEMA_CHECK;
            progress.accept(stage);
            ensureSchema(session, schema);

            List<Object[]> rows = toRows(batch);
            long before = session.countRows(schema.table(), WarehouseTable.TICKER_COLUMN, ticker);
            if (rows.isEmpty()) {
                return RemoteSyncResult.nothingToSync(schema.table(), before);
            }

            stage = SyncStage.STAGE_CREATE;
            progress.accept(stage);
            String staging = session.createStaging(schema);
            RemoteSyncException primary = null;
            boolean merged = false;
            try {
                stage = SyncStage.STAGE_WRITE;
                progress.accept(stage);
                session.writeStaging(staging, schema, rows);

                stage = SyncStage.STAGE_VERIFY;
                progress.accept(stage);
                long staged = session.countRows(staging);
                if (staged == 0) {
                    throw new RemoteWriteVerificationException(staging, rows.size());
                }
                if (staged != rows.size()) {
                    log.warn("{} {}: staged {} rows but submitted {}", schema.table(), ticker, staged, rows.size());
                }

                stage = SyncStage.UPSERT;
                progress.accept(stage);
                session.mergeStaging(staging, schema);
                merged = true;
                long after = session.countRows(schema.table(), WarehouseTable.TICKER_COLUMN, ticker);

                RemoteSyncResult result = new RemoteSyncResult(schema.table(), rows.size(), staged, before, after);
                metrics.counter("warehouse.rows.added").inc(result.rowsAdded());
                log.info("{} {}: upserted {} rows, {} new ({} -> {})",
                        schema.table(), ticker, staged, result.rowsAdded(), before, after);
                return result;
            } catch (RemoteSyncException e) {
                primary = e;
                throw e;
            } catch (SQLException e) {
                primary = new RemoteSyncException(stage, schema.table() + " " + ticker + ": " + e.getMessage(), e);
                throw primary;
            } finally {
                // failures keep reporting the stage that failed
                if (merged) progress.accept(SyncStage.CLEANUP);
                try {
                    session.dropTable(staging);
                } catch (SQLException e) {
                    if (primary != null) {
                        primary.addSuppressed(e);
                    } else {
                        log.warn("{} {}: could not drop staging table {}: {}", schema.table(), ticker, staging, e.toString());
                    }
                }
            }
        } catch (RemoteSyncException e) {
            metrics.counter("warehouse.sync.failures").inc();
            throw e;
        } catch (SQLException e) {
            metrics.counter("warehouse.sync.failures").inc();
            throw new RemoteSyncException(stage, schema.table() + " " + ticker + ": " + e.getMessage(), e);
        }
    }

    void ensureSchema(WarehouseSession session, TableSchema schema) throws SQLException, RemoteSchemaException {
        synchronized (schemaLock) {
            String name = schema.table();
            if (!session.tableExists(name)) {
                log.info("creating warehouse table {}", name);
                session.applySchemaChange(new SchemaChange.CreateTable(schema));
                return;
            }
            SchemaDiff diff = SchemaDiff.between(schema, session.describeTable(name));
            if (diff.isEmpty()) return;

            if (!diff.incompatible().isEmpty()) {
                long rows = session.countRows(name);
                if (rows == 0) {
                    log.warn("{} is empty and has incompatible columns {}, recreating it", name, diff.incompatible());
                    session.applySchemaChange(new SchemaChange.DropTable(name));
                    session.applySchemaChange(new SchemaChange.CreateTable(schema));
                    return;
                }
                log.error("{} holds {} rows and has incompatible columns {}; fix the table manually",
                        name, rows, diff.incompatible());
                throw new RemoteSchemaException(name + " has incompatible columns " + diff.incompatible()
                        + " and holds " + rows + " rows");
            }
            log.warn("{} is missing columns {}, adding them", name,
                    diff.missing().stream().map(ColumnDef::name).toList());
            session.applySchemaChange(new SchemaChange.AddColumns(name, diff.missing()));
        }
    }

    private List<Object[]> toRows(List<R> batch) {
        Instant now = clock.instant();
        Map<Object, R> byKey = new LinkedHashMap<>();
        for (R r : batch) byKey.put(table.key(r), r);
        List<Object[]> rows = new ArrayList<>(byKey.size());
        for (R r : byKey.values()) rows.add(table.toRow(r, now));
        return rows;
    }
}
