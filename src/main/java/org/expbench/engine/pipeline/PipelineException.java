package org.expbench.engine.pipeline;

/**
 * Raised when a shared table could not be built. Every query reading shared
 * tables is then failed with this precondition; there is no partial fallback.
 */
public class PipelineException extends RuntimeException {

    private final String table;

    public PipelineException(String table, Throwable cause) {
        super("Failed to build shared table " + table + ": " + cause.getMessage(), cause);
        this.table = table;
    }

    public String table() {
        return table;
    }
}
