package org.expbench.engine.pipeline;

import java.util.Objects;

/**
 * Location of one metric's pre-aggregated data.
 *
 * @param table         Shared table holding the data
 * @param column        Column with all values
 * @param nonzeroColumn Column restricted to non-zero values (sketch tables only), or null
 */
public record SharedColumn(String table, String column, String nonzeroColumn) {

    public SharedColumn {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(column, "Column cannot be null");
    }

    public static SharedColumn daily(String column) {
        return new SharedColumn(SharedTables.METRICS_DAILY, column, null);
    }

    public String column(boolean ignoreZeros) {
        if (ignoreZeros) {
            if (nonzeroColumn == null) {
                throw new IllegalStateException(table + "." + column + " has no non-zero variant");
            }
            return nonzeroColumn;
        }
        return column;
    }
}
