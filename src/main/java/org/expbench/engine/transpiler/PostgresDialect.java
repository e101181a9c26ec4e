package org.expbench.engine.transpiler;

import org.expbench.engine.plan.DurationUnit;

/**
 * SQL dialect implementation for PostgreSQL.
 *
 * Approximate percentiles and sketch tables rely on the {@code tdigest}
 * extension, which must be installed on the server.
 */
public final class PostgresDialect implements SQLDialect {

    public static final PostgresDialect INSTANCE = new PostgresDialect();

    static final int TDIGEST_COMPRESSION = 100;

    private PostgresDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "Postgres";
    }

    @Override
    public String engineId() {
        return "postgres";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String doubleType() {
        return "DOUBLE PRECISION";
    }

    @Override
    public String adjust(String expression, long amount, DurationUnit unit) {
        String op = amount < 0 ? " - " : " + ";
        long magnitude = Math.abs(amount);
        if (unit == DurationUnit.DAYS) {
            return "(" + expression + op + magnitude + ")";
        }
        return "(" + expression + op + "INTERVAL '" + magnitude + " " + unit.sql() + "s')";
    }

    @Override
    public String percentile(String argument, String quantile) {
        return "PERCENTILE_CONT(" + quantile + ") WITHIN GROUP (ORDER BY " + argument + ")";
    }

    @Override
    public String approxPercentile(String argument, String quantile) {
        return "tdigest_percentile(CAST(" + argument + " AS " + doubleType() + "), "
                + TDIGEST_COMPRESSION + ", " + quantile + ")";
    }

    @Override
    public boolean supportsTdigest() {
        return true;
    }

    @Override
    public String tdigestAgg(String value, String filter) {
        return "tdigest(CAST(" + value + " AS " + doubleType() + "), " + TDIGEST_COMPRESSION
                + ") FILTER (WHERE " + filter + ")";
    }

    @Override
    public String tdigestPercentile(String digest, String quantile) {
        return "tdigest_percentile(" + digest + ", " + quantile + ")";
    }

    @Override
    public String tdigestSetup() {
        return "CREATE EXTENSION IF NOT EXISTS tdigest";
    }
}
