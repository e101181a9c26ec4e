package org.expbench.engine.transpiler;

import org.expbench.engine.plan.DurationUnit;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers and single quotes for strings.
 * Array sketches only: DuckDB has no t-digest type.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String engineId() {
        return "duckdb";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String doubleType() {
        return "DOUBLE";
    }

    @Override
    public String adjust(String expression, long amount, DurationUnit unit) {
        String op = amount < 0 ? " - " : " + ";
        long magnitude = Math.abs(amount);
        if (unit == DurationUnit.DAYS) {
            // DATE +/- INTEGER stays a DATE
            return "(" + expression + op + magnitude + ")";
        }
        return "(" + expression + op + "INTERVAL " + magnitude + " " + unit.sql().toUpperCase() + ")";
    }

    @Override
    public String percentile(String argument, String quantile) {
        return "QUANTILE_CONT(" + argument + ", " + quantile + ")";
    }

    @Override
    public String approxPercentile(String argument, String quantile) {
        return "APPROX_QUANTILE(" + argument + ", " + quantile + ")";
    }
}
