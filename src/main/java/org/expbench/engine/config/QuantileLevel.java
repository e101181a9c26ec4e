package org.expbench.engine.config;

public enum QuantileLevel {
    /** Every qualifying raw row is one observation. */
    EVENT,
    /** Rows are summed per user first; every user is one observation. */
    UNIT;

    public static QuantileLevel fromKey(String key) {
        return ConfigEnums.parse(QuantileLevel.class, key, "quantile level");
    }
}
