package org.expbench.engine.transpiler;

import org.expbench.engine.plan.DurationUnit;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations supply the fragments that differ between database engines:
 * quoting, date flooring and arithmetic, percentile functions, array and
 * sketch syntax. Query composition never branches on the engine; it asks the
 * dialect for these fragments instead.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB", "Postgres")
     */
    String name();

    /**
     * @return The engine identifier used to look the dialect up (e.g., "duckdb")
     */
    String engineId();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    default String quoteStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Format a boolean literal.
     */
    default String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    /**
     * Format a NULL literal.
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Name of the double precision floating point type.
     */
    String doubleType();

    /**
     * Floors a timestamp expression to its calendar day.
     */
    default String castToDate(String expression) {
        return "CAST(" + expression + " AS DATE)";
    }

    /**
     * Shifts a timestamp by a signed number of hours or a date by a signed number of days.
     *
     * @param expression The rendered date/timestamp expression
     * @param amount     Signed amount, never zero
     * @param unit       HOURS for timestamps, DAYS for dates
     */
    String adjust(String expression, long amount, DurationUnit unit);

    /**
     * Hour of day (0-23) of a timestamp.
     */
    default String extractHour(String expression) {
        return "EXTRACT(HOUR FROM " + expression + ")";
    }

    /**
     * Exact continuous percentile aggregate.
     */
    String percentile(String argument, String quantile);

    /**
     * Approximate percentile aggregate over raw values.
     */
    String approxPercentile(String argument, String quantile);

    /**
     * Ordered array aggregate restricted to rows matching the filter.
     */
    default String arrayAgg(String value, String filter) {
        return "ARRAY_AGG(" + value + " ORDER BY " + value + ") FILTER (WHERE " + filter + ")";
    }

    /**
     * Collects the distinct values of a day into an array.
     */
    default String arrayAggDistinct(String value, String filter) {
        return "ARRAY_AGG(DISTINCT " + value + ") FILTER (WHERE " + filter + ")";
    }

    /**
     * Expands an array column into one row per element (select-list form).
     */
    default String unnest(String array) {
        return "UNNEST(" + array + ")";
    }

    /**
     * @return True if the engine can build and merge t-digest sketches
     */
    default boolean supportsTdigest() {
        return false;
    }

    /**
     * T-digest aggregate over the rows matching the filter.
     */
    default String tdigestAgg(String value, String filter) {
        throw new UnsupportedOperationException(name() + " does not support t-digest sketches");
    }

    /**
     * Percentile of a set of merged t-digest sketches.
     */
    default String tdigestPercentile(String digest, String quantile) {
        throw new UnsupportedOperationException(name() + " does not support t-digest sketches");
    }

    /**
     * Statements that must run before t-digest tables can be built.
     */
    default String tdigestSetup() {
        throw new UnsupportedOperationException(name() + " does not support t-digest sketches");
    }

    default String dropTableIfExists(String table) {
        return "DROP TABLE IF EXISTS " + quoteIdentifier(table) + " CASCADE";
    }
}
