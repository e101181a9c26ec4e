package org.expbench.engine.config;

/**
 * How qualifying rows of a count metric combine into one value per user.
 */
public enum Aggregation {
    SUM,
    COUNT,
    COUNT_DISTINCT,
    /** Template supplied by the metric, containing a {@code {value}} placeholder. */
    CUSTOM;

    public static Aggregation fromKey(String key) {
        return ConfigEnums.parse(Aggregation.class, key, "aggregation");
    }
}
