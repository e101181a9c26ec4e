package org.expbench.engine.config;

public enum DimensionType {
    /** Calendar day of the user's first exposure. */
    DATE,
    /** A column of the exposure table (browser, country...). */
    EXPOSURE,
    /** A column of an external per-user attribute table. */
    ATTRIBUTE,
    /** Whether the user reached the experiment's activation event. */
    ACTIVATION;

    public static DimensionType fromKey(String key) {
        return ConfigEnums.parse(DimensionType.class, key, "dimension type");
    }
}
