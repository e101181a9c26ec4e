package org.expbench.engine.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link QueryExecutor} over a single JDBC connection.
 * Every statement gets the configured query timeout (0 disables it).
 *
 * <p>Drivers that ignore {@link Statement#setQueryTimeout} (DuckDB) are covered by a
 * watchdog that cancels the statement once the timeout elapses; the cancelled call
 * then fails with {@link SQLTimeoutException}.</p>
 */
public final class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final Connection connection;
    private final int timeoutSeconds;
    private final ScheduledExecutorService watchdog;

    public JdbcQueryExecutor(Connection connection, int timeoutSeconds) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
        this.watchdog = timeoutSeconds > 0
                ? Executors.newSingleThreadScheduledExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "query-timeout");
                    thread.setDaemon(true);
                    return thread;
                })
                : null;
    }

    /**
     * Connects to a JDBC target (see {@link ConnectionResolver}).
     */
    public static JdbcQueryExecutor connect(String target, int timeoutSeconds) throws SQLException {
        return new JdbcQueryExecutor(ConnectionResolver.resolve(target), timeoutSeconds);
    }

    @Override
    public void execute(String sql) throws SQLException {
        try (Statement stmt = newStatement()) {
            withTimeout(stmt, () -> {
                stmt.execute(sql);
                return null;
            });
        }
    }

    @Override
    public RelationResult executeQuery(String sql) throws SQLException {
        try (Statement stmt = newStatement()) {
            return withTimeout(stmt, () -> {
                try (ResultSet rs = stmt.executeQuery(sql)) {
                    return RelationResult.fromResultSet(rs);
                }
            });
        }
    }

    private Statement newStatement() throws SQLException {
        Statement stmt = connection.createStatement();
        if (timeoutSeconds > 0) {
            stmt.setQueryTimeout(timeoutSeconds);
        }
        return stmt;
    }

    private <T> T withTimeout(Statement stmt, StatementCall<T> call) throws SQLException {
        if (watchdog == null) {
            return call.run();
        }
        AtomicBoolean cancelled = new AtomicBoolean();
        ScheduledFuture<?> cancel = watchdog.schedule(() -> {
            cancelled.set(true);
            try {
                stmt.cancel();
            } catch (SQLException e) {
                LOG.warn("Failed to cancel statement after {} s", timeoutSeconds, e);
            }
        }, timeoutSeconds, TimeUnit.SECONDS);
        try {
            return call.run();
        } catch (SQLException e) {
            if (cancelled.get() && !(e instanceof SQLTimeoutException)) {
                throw new SQLTimeoutException("Query cancelled after " + timeoutSeconds + " s", e);
            }
            throw e;
        } finally {
            cancel.cancel(false);
        }
    }

    public Connection connection() {
        return connection;
    }

    @Override
    public void close() throws SQLException {
        if (watchdog != null) {
            watchdog.shutdownNow();
        }
        if (!connection.isClosed()) {
            LOG.debug("Closing connection");
            connection.close();
        }
    }

    @FunctionalInterface
    private interface StatementCall<T> {
        T run() throws SQLException;
    }
}
