package io.marketsync.market.config;

import io.marketsync.market.error.ConfigurationException;
import io.marketsync.market.warehouse.PriceHistoryTable;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WarehouseConfigTest {

    private static Map<String, String> snowflakeEnv() {
        Map<String, String> env = new HashMap<>();
        env.put("SNOWFLAKE_ACCOUNT", "xy12345");
        env.put("SNOWFLAKE_USER", "loader");
        env.put("SNOWFLAKE_PASSWORD", "secret");
        env.put("SNOWFLAKE_WAREHOUSE", "COMPUTE_WH");
        env.put("SNOWFLAKE_DATABASE", "MARKET");
        env.put("SNOWFLAKE_SCHEMA", "PUBLIC");
        return env;
    }

    @Test
    void snowflakeUrlIsDerivedFromTheAccount() {
        WarehouseConfig c = WarehouseConfig.fromEnv(snowflakeEnv()).validate();

        assertEquals("jdbc:snowflake://xy12345.snowflakecomputing.com/", c.jdbcUrl());
        assertTrue(c.isSnowflake());
        assertEquals(PriceHistoryTable.DEFAULT_NAME, c.priceTable());
    }

    @Test
    void connectionPropertiesCarrySessionContext() {
        Properties p = WarehouseConfig.fromEnv(snowflakeEnv()).connectionProperties();

        assertEquals("loader", p.getProperty("user"));
        assertEquals("COMPUTE_WH", p.getProperty("warehouse"));
        assertEquals("MARKET", p.getProperty("db"));
        assertEquals("PUBLIC", p.getProperty("schema"));
        assertNull(p.getProperty("useProxy"));
    }

    @Test
    void missingCredentialsAreReportedTogether() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> WarehouseConfig.fromEnv(Map.of()).validate());

        assertEquals(3, e.problems().size());
    }

    @Test
    void nonSnowflakeOverrideNeedsNoSnowflakeCredentials() {
        WarehouseConfig c = WarehouseConfig.fromEnv(Map.of("WAREHOUSE_JDBC_URL", "jdbc:h2:mem:x")).validate();

        assertFalse(c.isSnowflake());
        assertTrue(c.connectionProperties().isEmpty());
    }

    @Test
    void toStringHidesSecrets() {
        assertFalse(WarehouseConfig.fromEnv(snowflakeEnv()).toString().contains("secret"));
    }

    @Test
    void proxyPortMustBeNumeric() {
        Map<String, String> env = snowflakeEnv();
        env.put("SNOWFLAKE_PROXY_HOST", "proxy.local");
        env.put("SNOWFLAKE_PROXY_PORT", "http");

        assertThrows(ConfigurationException.class, () -> WarehouseConfig.fromEnv(env).validate());
    }
}
