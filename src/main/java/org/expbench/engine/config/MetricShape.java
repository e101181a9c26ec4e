package org.expbench.engine.config;

public enum MetricShape {
    BINOMIAL,
    COUNT,
    RATIO,
    QUANTILE;

    public static MetricShape fromKey(String key) {
        return ConfigEnums.parse(MetricShape.class, key, "metric type");
    }
}
