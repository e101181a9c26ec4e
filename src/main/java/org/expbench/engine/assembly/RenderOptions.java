package org.expbench.engine.assembly;

/**
 * Engine-independent rendering switches.
 *
 * @param approxQuantile Use the engine's approximate percentile for quantile metrics
 * @param tdigest        Read pre-agg quantiles from t-digest sketches instead of value arrays
 */
public record RenderOptions(boolean approxQuantile, boolean tdigest) {

    public static final RenderOptions DEFAULT = new RenderOptions(false, false);
}
