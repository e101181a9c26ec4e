package org.expbench.engine.metric;

import org.expbench.engine.config.CupedSpec;
import org.expbench.engine.config.MetricConfig;

import java.util.Objects;

/**
 * One per-user value the query computes.
 *
 * @param role   MAIN for single metrics and ratio numerators, DENOMINATOR for ratio denominators
 * @param metric The metric that defines the value (may be a threshold metric)
 * @param source The metric whose rows are read; differs from {@code metric} only for threshold metrics
 * @param cuped  Covariate settings inherited from the analysed metric, or null
 */
public record MetricComponent(MetricRole role, MetricConfig metric, MetricConfig source, CupedSpec cuped) {

    public MetricComponent {
        Objects.requireNonNull(role, "Role cannot be null");
        Objects.requireNonNull(metric, "Metric cannot be null");
        Objects.requireNonNull(source, "Source metric cannot be null");
    }

    public boolean isCapped() {
        return metric.isCapped();
    }

    public boolean hasCovariate() {
        return cuped != null;
    }

    public String prefix() {
        return role.prefix();
    }
}
