package org.expbench.engine.execution;

import java.sql.SQLException;

/**
 * Execution interface the benchmark runs against: one open handle to one database.
 *
 * Failures surface as {@link SQLException}; a query exceeding the configured timeout
 * raises {@link java.sql.SQLTimeoutException}.
 */
public interface QueryExecutor extends AutoCloseable {

    /**
     * Executes DDL or DML, discarding any result.
     */
    void execute(String sql) throws SQLException;

    /**
     * Executes a query and materializes its rows.
     */
    RelationResult executeQuery(String sql) throws SQLException;

    @Override
    void close() throws SQLException;
}
