package org.expbench.engine.plan;

/**
 * Duration units used by window arithmetic.
 * Timestamp-precision windows shift by hours, date-precision windows by days.
 */
public enum DurationUnit {
    DAYS("day"),
    HOURS("hour");

    private final String sql;

    DurationUnit(String sql) {
        this.sql = sql;
    }

    /**
     * @return The singular SQL unit name
     */
    public String sql() {
        return sql;
    }
}
