package org.expbench.engine.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Statements that (re)build one shared table, executed in order.
 */
public record PipelineStatement(String table, List<String> statements) {

    public PipelineStatement {
        Objects.requireNonNull(table, "Table cannot be null");
        statements = List.copyOf(statements);
        if (statements.isEmpty()) {
            throw new IllegalArgumentException("No statements for " + table);
        }
    }

    /**
     * The statements as one script, each terminated by a semicolon.
     */
    public String script() {
        StringBuilder sb = new StringBuilder();
        for (String statement : statements) {
            sb.append(statement).append(";\n");
        }
        return sb.toString();
    }
}
