package org.expbench.engine.metric;

import org.expbench.engine.plan.Expression;

/**
 * Per-user aggregate expressions of one component.
 *
 * @param value     Value over the conversion window
 * @param covariate Value over the CUPED covariate window, or null
 */
public record MetricClause(Expression value, Expression covariate) {

    public boolean hasCovariate() {
        return covariate != null;
    }
}
