package org.expbench.engine.plan;

import java.util.Objects;

/**
 * Continuous percentile of an argument over the rows of a group.
 * The function name and argument order differ by engine and are supplied by the dialect.
 *
 * @param argument    The value whose distribution is summarised
 * @param quantile    Target quantile in (0, 1)
 * @param approximate True to use the engine's approximate (sketch based) percentile
 */
public record PercentileExpression(
        Expression argument,
        double quantile,
        boolean approximate) implements Expression {

    public PercentileExpression {
        Objects.requireNonNull(argument, "Percentile argument cannot be null");
        if (!(quantile > 0.0 && quantile < 1.0)) {
            throw new IllegalArgumentException("Quantile must be in (0, 1): " + quantile);
        }
    }

    public static PercentileExpression exact(Expression argument, double quantile) {
        return new PercentileExpression(argument, quantile, false);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitPercentile(this);
    }
}
