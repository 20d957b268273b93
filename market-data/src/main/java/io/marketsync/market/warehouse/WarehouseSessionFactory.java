package io.marketsync.market.warehouse;

import java.sql.SQLException;

@FunctionalInterface
public interface WarehouseSessionFactory {
    WarehouseSession open() throws SQLException;
}
