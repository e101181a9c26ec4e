package org.expbench.engine.config;

import java.util.Objects;

public record QuantileSpec(double quantile, QuantileLevel level, boolean ignoreZeros) {

    public QuantileSpec {
        Objects.requireNonNull(level, "Quantile level cannot be null");
        if (!(quantile > 0.0 && quantile < 1.0)) {
            throw new ConfigException("quantile must be in (0, 1): " + quantile);
        }
    }
}
