package org.expbench.engine.config;

/**
 * Relative tolerances applied when comparing on-demand and pre-agg aggregates.
 *
 * @param unweighted Unweighted pre-agg against on-demand
 * @param weighted   Weighted pre-agg against on-demand
 * @param quantile   Quantile values (exact or approximate)
 * @param capped     Capped metrics, whose thresholds are computed per approach
 */
public record Tolerances(double unweighted, double weighted, double quantile, double capped) {

    public static final Tolerances DEFAULT = new Tolerances(0.10, 0.05, 0.15, 0.10);

    public Tolerances {
        check("unweighted", unweighted);
        check("weighted", weighted);
        check("quantile", quantile);
        check("capped", capped);
    }

    private static void check(String name, double value) {
        if (!(value >= 0.0 && value < 1.0)) {
            throw new ConfigException("Tolerance " + name + " must be in [0, 1): " + value);
        }
    }
}
