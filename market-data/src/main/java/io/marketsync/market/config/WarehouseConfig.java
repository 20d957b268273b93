package io.marketsync.market.config;

import io.marketsync.market.error.ConfigurationException;
import io.marketsync.market.warehouse.NewsTable;
import io.marketsync.market.warehouse.PriceHistoryTable;
import io.marketsync.market.warehouse.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Connection settings for the remote warehouse, read from {@code SNOWFLAKE_*} variables.
 * {@code WAREHOUSE_JDBC_URL} replaces the Snowflake URL derived from the account; with a non-Snowflake URL the
 * Snowflake credentials are not required.
 */
public record WarehouseConfig(
        String jdbcUrlOverride,
        String account,
        String user,
        String password,
        String privateKeyPath,
        String privateKeyPassphrase,
        String authenticator,
        String token,
        String warehouse,
        String database,
        String schema,
        String role,
        boolean keepAlive,
        String proxyHost,
        String proxyPort,
        String proxyUser,
        String proxyPassword,
        String priceTable,
        String newsTable
) {
    public static WarehouseConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static WarehouseConfig fromEnv(Map<String, String> env) {
        return new WarehouseConfig(
                blankToNull(env.get("WAREHOUSE_JDBC_URL")),
                blankToNull(env.get("SNOWFLAKE_ACCOUNT")),
                blankToNull(env.get("SNOWFLAKE_USER")),
                blankToNull(env.get("SNOWFLAKE_PASSWORD")),
                blankToNull(env.get("SNOWFLAKE_PRIVATE_KEY_PATH")),
                blankToNull(env.get("SNOWFLAKE_PRIVATE_KEY_PASSPHRASE")),
                blankToNull(env.get("SNOWFLAKE_AUTHENTICATOR")),
                blankToNull(env.get("SNOWFLAKE_TOKEN")),
                blankToNull(env.get("SNOWFLAKE_WAREHOUSE")),
                blankToNull(env.get("SNOWFLAKE_DATABASE")),
                blankToNull(env.get("SNOWFLAKE_SCHEMA")),
                blankToNull(env.get("SNOWFLAKE_ROLE")),
                Boolean.parseBoolean(env.getOrDefault("CLIENT_SESSION_KEEP_ALIVE", "false")),
                blankToNull(env.get("SNOWFLAKE_PROXY_HOST")),
                blankToNull(env.get("SNOWFLAKE_PROXY_PORT")),
                blankToNull(env.get("SNOWFLAKE_PROXY_USER")),
                blankToNull(env.get("SNOWFLAKE_PROXY_PASSWORD")),
                env.getOrDefault("SNOWFLAKE_PRICE_TABLE", PriceHistoryTable.DEFAULT_NAME),
                env.getOrDefault("SNOWFLAKE_NEWS_TABLE", NewsTable.DEFAULT_NAME));
    }

    public boolean isSnowflake() {
        return SqlDialect.forUrl(jdbcUrl()) == SqlDialect.SNOWFLAKE;
    }

    public String jdbcUrl() {
        if (jdbcUrlOverride != null) return jdbcUrlOverride;
        return account == null ? null : "jdbc:snowflake://" + account + ".snowflakecomputing.com/";
    }

    public WarehouseConfig validate() {
        List<String> problems = new ArrayList<>();
        if (jdbcUrlOverride == null || isSnowflake()) {
            if (account == null && jdbcUrlOverride == null) problems.add("SNOWFLAKE_ACCOUNT is required");
            if (user == null) problems.add("SNOWFLAKE_USER is required");
            if (password == null && privateKeyPath == null && authenticator == null) {
                problems.add("one of SNOWFLAKE_PASSWORD, SNOWFLAKE_PRIVATE_KEY_PATH or SNOWFLAKE_AUTHENTICATOR is required");
            }
        }
        if (proxyPort != null) {
            try {
                Integer.parseInt(proxyPort);
            } catch (NumberFormatException e) {
                problems.add("SNOWFLAKE_PROXY_PORT is not a number: " + proxyPort);
            }
        }
        if (!problems.isEmpty()) throw new ConfigurationException(problems);
        return this;
    }

    /** Driver properties; Snowflake-specific keys are only set for Snowflake URLs. */
    public Properties connectionProperties() {
        Properties p = new Properties();
        putIfSet(p, "user", user);
        putIfSet(p, "password", password);
        if (isSnowflake()) {
            if (password == null) {
                putIfSet(p, "private_key_file", privateKeyPath);
                putIfSet(p, "private_key_file_pwd", privateKeyPassphrase);
            }
            putIfSet(p, "authenticator", authenticator);
            putIfSet(p, "token", token);
            putIfSet(p, "warehouse", warehouse);
            putIfSet(p, "db", database);
            putIfSet(p, "schema", schema);
            putIfSet(p, "role", role);
            if (keepAlive) p.put("CLIENT_SESSION_KEEP_ALIVE", "true");
            if (proxyHost != null) {
                p.put("useProxy", "true");
                p.put("proxyHost", proxyHost);
                putIfSet(p, "proxyPort", proxyPort);
                putIfSet(p, "proxyUser", proxyUser);
                putIfSet(p, "proxyPassword", proxyPassword);
            }
        }
        return p;
    }

    @Override
    public String toString() {
        return "WarehouseConfig{url=" + jdbcUrl() + ", user=" + user + ", warehouse=" + warehouse
                + ", database=" + database + ", schema=" + schema + ", role=" + role
                + ", tables=" + priceTable + "/" + newsTable + "}";
    }

    private static void putIfSet(Properties p, String key, String value) {
        if (value != null) p.put(key, value);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
