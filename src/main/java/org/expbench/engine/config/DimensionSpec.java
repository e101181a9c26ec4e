package org.expbench.engine.config;

import java.util.Objects;

/**
 * Breakdown column added to the final GROUP BY.
 *
 * @param type   Where the dimension value comes from
 * @param column Source column; required for EXPOSURE and ATTRIBUTE
 * @param table  Attribute table; required for ATTRIBUTE
 */
public record DimensionSpec(DimensionType type, String column, String table) {

    public DimensionSpec {
        Objects.requireNonNull(type, "Dimension type cannot be null");
        if ((type == DimensionType.EXPOSURE || type == DimensionType.ATTRIBUTE) && isBlank(column)) {
            throw new ConfigException(type + " dimension requires a column");
        }
        if (type == DimensionType.ATTRIBUTE && isBlank(table)) {
            throw new ConfigException("ATTRIBUTE dimension requires a table");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
