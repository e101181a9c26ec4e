package org.expbench.engine.pipeline;

import org.expbench.engine.execution.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes compiled pipeline statements against one executor, table by table.
 * The first failing table stops the build; later tables are not attempted.
 */
public final class PipelineBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineBuilder.class);

    private final QueryExecutor executor;

    public PipelineBuilder(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
    }

    /**
     * Builds every table, recording a failure instead of throwing.
     */
    public PipelineResult build(List<PipelineStatement> statements) {
        Map<String, Double> timings = new LinkedHashMap<>();
        try {
            buildOrThrow(statements, timings);
            LOG.info("Pipeline built {} tables", timings.size());
            return new PipelineResult(timings, null);
        } catch (PipelineException e) {
            LOG.error(e.getMessage());
            return new PipelineResult(timings, e);
        }
    }

    private void buildOrThrow(List<PipelineStatement> statements, Map<String, Double> timings) {
        for (PipelineStatement statement : statements) {
            long start = System.nanoTime();
            for (String sql : statement.statements()) {
                LOG.debug("Pipeline statement for {}:\n{}", statement.table(), sql);
                try {
                    executor.execute(sql);
                } catch (SQLException e) {
                    throw new PipelineException(statement.table(), e);
                }
            }
            double seconds = (System.nanoTime() - start) / 1e9;
            timings.put(statement.table(), seconds);
            LOG.info("Built {} in {} s", statement.table(), String.format("%.3f", seconds));
        }
    }
}
