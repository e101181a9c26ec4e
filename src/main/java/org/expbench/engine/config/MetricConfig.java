package org.expbench.engine.config;

import java.util.Objects;

/**
 * Resolved definition of one metric.
 *
 * <p>Binomial and count metrics read {@code value} from {@code table}, restricted
 * to rows matching {@code where}. A ratio names two such metrics. A binomial with
 * {@code thresholdOf} set has no source of its own: it is 1 for users whose value
 * of the referenced metric reaches {@code threshold}.</p>
 *
 * @param capPercentile Percentile of per-user totals used as an upper clamp, or null
 * @param cuped         Covariate adjustment, or null
 * @param quantile      Quantile settings, only for the QUANTILE shape
 */
public record MetricConfig(
        String id,
        MetricShape shape,
        String table,
        String timestampColumn,
        String idType,
        String value,
        String where,
        Aggregation aggregation,
        String aggregateTemplate,
        Rollup rollup,
        boolean preserveNulls,
        Double capPercentile,
        CupedSpec cuped,
        String numerator,
        String denominator,
        QuantileSpec quantile,
        String thresholdOf,
        Double threshold) {

    public static final String VALUE_PLACEHOLDER = "{value}";

    public MetricConfig {
        Objects.requireNonNull(id, "Metric id cannot be null");
        Objects.requireNonNull(shape, "Metric shape cannot be null");
        Objects.requireNonNull(aggregation, "Aggregation cannot be null");

        switch (shape) {
            case RATIO -> {
                if (numerator == null || denominator == null) {
                    throw new ConfigException(id + ": ratio metric requires numerator and denominator");
                }
            }
            case QUANTILE -> {
                if (quantile == null) {
                    throw new ConfigException(id + ": quantile metric requires quantile settings");
                }
                requireSource(id, table, value);
            }
            case BINOMIAL, COUNT -> {
                if (thresholdOf != null) {
                    if (shape != MetricShape.BINOMIAL || threshold == null) {
                        throw new ConfigException(id + ": threshold_of requires a binomial metric with a threshold");
                    }
                } else {
                    requireSource(id, table, value);
                }
            }
        }
        if (aggregation == Aggregation.CUSTOM
                && (aggregateTemplate == null || !aggregateTemplate.contains(VALUE_PLACEHOLDER))) {
            throw new ConfigException(id + ": custom aggregation requires an aggregate template containing "
                    + VALUE_PLACEHOLDER);
        }
        if (capPercentile != null && !(capPercentile > 0.0 && capPercentile < 1.0)) {
            throw new ConfigException(id + ": capping percentile must be in (0, 1): " + capPercentile);
        }
    }

    private static void requireSource(String id, String table, String value) {
        if (table == null || table.isBlank()) {
            throw new ConfigException(id + ": metric requires a table");
        }
        if (value == null || value.isBlank()) {
            throw new ConfigException(id + ": metric requires a value expression");
        }
    }

    public boolean isCapped() {
        return capPercentile != null;
    }

    public boolean isCuped() {
        return cuped != null;
    }

    public boolean isDerived() {
        return thresholdOf != null;
    }

    /**
     * Daily rollup: binomial flags combine with MAX, everything else with SUM
     * unless a custom aggregation names its own rollup.
     */
    public Rollup effectiveRollup() {
        if (shape == MetricShape.BINOMIAL) {
            return Rollup.MAX;
        }
        return rollup != null ? rollup : Rollup.SUM;
    }
}
