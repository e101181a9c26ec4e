package org.expbench.engine.assembly;

import org.expbench.engine.window.Approach;

import java.util.Objects;

/**
 * Identity of one rendering: (experiment, metric, approach, weighting mode).
 */
public record QueryKey(String experimentId, String metricId, Approach approach, Variant variant) {

    public QueryKey {
        Objects.requireNonNull(experimentId, "Experiment id cannot be null");
        Objects.requireNonNull(metricId, "Metric id cannot be null");
        Objects.requireNonNull(approach, "Approach cannot be null");
        Objects.requireNonNull(variant, "Variant cannot be null");
        if (!variant.appliesTo(approach)) {
            throw new IllegalArgumentException(variant + " does not apply to " + approach);
        }
    }

    /**
     * Key of the rendering this one is validated against, or this key for on-demand.
     */
    public QueryKey reference() {
        return new QueryKey(experimentId, metricId, Approach.ONDEMAND, Variant.STANDARD);
    }

    @Override
    public String toString() {
        return approach.key() + "/" + experimentId + "/" + metricId
                + (approach == Approach.PREAGG ? "__" + variant.key() : "");
    }
}
