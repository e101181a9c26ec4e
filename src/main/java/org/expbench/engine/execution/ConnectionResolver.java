package org.expbench.engine.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Resolves a JDBC target to a live connection.
 *
 * Supports:
 * - In-memory DuckDB ({@code jdbc:duckdb:}) and file DuckDB ({@code jdbc:duckdb:/path/db})
 * - PostgreSQL ({@code jdbc:postgresql://host:port/db?user=...})
 *
 * A bare file path is treated as a DuckDB database file.
 */
public final class ConnectionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionResolver.class);

    // Force-load JDBC drivers at class initialization
    static {
        loadDriver("org.duckdb.DuckDBDriver");
        loadDriver("org.postgresql.Driver");
    }

    private ConnectionResolver() {
    }

    private static void loadDriver(String className) {
        try {
            Class.forName(className);
        } catch (ClassNotFoundException e) {
            LOG.warn("JDBC driver {} not found in classpath", className);
        }
    }

    /**
     * Opens a connection to the given target.
     *
     * @param target JDBC URL or DuckDB file path
     * @return A live JDBC Connection
     * @throws SQLException If connection fails
     */
    public static Connection resolve(String target) throws SQLException {
        String url = toJdbcUrl(target);
        LOG.debug("Connecting to {}", url);
        return DriverManager.getConnection(url);
    }

    static String toJdbcUrl(String target) {
        if (target == null || target.isBlank()) {
            return "jdbc:duckdb:";
        }
        if (target.startsWith("jdbc:")) {
            return target;
        }
        if (target.startsWith("postgresql://")) {
            return "jdbc:" + target;
        }
        return "jdbc:duckdb:" + target;
    }

    /**
     * Creates an in-memory DuckDB connection.
     * Convenience method for testing.
     */
    public static Connection createInMemoryDuckDB() throws SQLException {
        return DriverManager.getConnection("jdbc:duckdb:");
    }
}
