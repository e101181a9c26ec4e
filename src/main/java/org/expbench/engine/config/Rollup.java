package org.expbench.engine.config;

/**
 * How per-day pre-aggregates combine into a per-user value across the window.
 */
public enum Rollup {
    SUM,
    MAX;

    public static Rollup fromKey(String key) {
        return ConfigEnums.parse(Rollup.class, key, "rollup");
    }
}
