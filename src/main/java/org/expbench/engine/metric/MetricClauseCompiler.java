package org.expbench.engine.metric;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.expbench.engine.config.Aggregation;
import org.expbench.engine.config.MetricCatalog;
import org.expbench.engine.config.MetricConfig;
import org.expbench.engine.config.MetricShape;
import org.expbench.engine.config.QuantileSpec;
import org.expbench.engine.plan.AggregateExpression;
import org.expbench.engine.plan.ArithmeticExpression;
import org.expbench.engine.plan.CaseExpression;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.plan.PercentileExpression;
import org.expbench.engine.plan.RawSqlExpression;
import org.expbench.engine.plan.SqlFunctionCall;
import org.expbench.engine.window.Approach;
import org.expbench.engine.window.WindowBounds;

import java.util.Objects;

/**
 * Builds the value, covariate, cap and quantile expressions of a metric.
 *
 * <p>Per-user values are always aggregates of a windowed row value:
 * {@code AGG(CASE WHEN <in window> THEN <row value> [* <first-day weight>] END)}.
 * On-demand rows are raw events and aggregate with the metric's own aggregation;
 * pre-agg rows are daily pre-aggregates and combine with the metric's rollup, except
 * distinct counts, which count the distinct values kept per day.</p>
 */
public final class MetricClauseCompiler {

    private static final Literal ZERO = Literal.integer(0);
    private static final Literal ONE = Literal.integer(1);

    private final MetricCatalog catalog;

    public MetricClauseCompiler(MetricCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
    }

    /**
     * Components of a metric: numerator and denominator for a ratio, the metric itself otherwise.
     */
    public ImmutableList<MetricComponent> components(MetricConfig metric) {
        if (metric.shape() == MetricShape.RATIO) {
            MetricConfig numerator = catalog.get(metric.numerator());
            MetricConfig denominator = catalog.get(metric.denominator());
            return Lists.immutable.of(
                    new MetricComponent(MetricRole.MAIN, numerator, catalog.sourceOf(numerator), metric.cuped()),
                    new MetricComponent(MetricRole.DENOMINATOR, denominator, catalog.sourceOf(denominator),
                            metric.cuped()));
        }
        return Lists.immutable.of(
                new MetricComponent(MetricRole.MAIN, metric, catalog.sourceOf(metric), metric.cuped()));
    }

    /**
     * Value a raw source row contributes: 1 for binomial flags, the value expression otherwise.
     */
    public Expression rowValue(MetricConfig source) {
        return source.shape() == MetricShape.BINOMIAL ? ONE : RawSqlExpression.of(source.value());
    }

    /**
     * Row predicate of a raw source, or null when every row qualifies.
     */
    public Expression rowFilter(MetricConfig source) {
        return source.where() == null ? null : RawSqlExpression.of(source.where());
    }

    /**
     * Compiles the main and covariate per-user aggregates of a component.
     *
     * @param rowValue  Per-row value (raw value on-demand, daily column pre-agg)
     * @param point     Event timestamp (on-demand) or metric date (pre-agg)
     * @param window    Conversion window
     * @param covariate Covariate window, ignored unless the component has CUPED
     * @param weighted  Apply first-day weighting to the conversion window
     */
    public MetricClause compile(MetricComponent component, Approach approach, Expression rowValue,
                                Expression point, WindowBounds window, WindowBounds covariate, boolean weighted) {
        Expression value = perUserValue(component, approach, rowValue, point, window, weighted);
        Expression covariateValue = component.hasCovariate()
                ? perUserValue(component, approach, rowValue, point, covariate, false)
                : null;
        return new MetricClause(value, covariateValue);
    }

    /**
     * Aggregates the in-window rows of one user into a single value.
     */
    public Expression perUserValue(MetricComponent component, Approach approach, Expression rowValue,
                                   Expression point, WindowBounds window, boolean weighted) {
        Expression contribution = weighted
                ? ArithmeticExpression.multiply(rowValue, window.firstDayWeight(point))
                : rowValue;
        Expression windowed = CaseExpression.when(window.contains(point), contribution);
        Expression aggregate = aggregate(component.source(), approach, windowed);

        if (component.metric().isDerived()) {
            return CaseExpression.of(
                    ComparisonExpression.greaterThanOrEquals(
                            SqlFunctionCall.coalesce(aggregate, ZERO),
                            Literal.decimal(component.metric().threshold())),
                    ONE,
                    ZERO);
        }
        MetricConfig source = component.source();
        if (source.shape() != MetricShape.BINOMIAL && source.preserveNulls()) {
            return aggregate;
        }
        return SqlFunctionCall.coalesce(aggregate, ZERO);
    }

    private Expression aggregate(MetricConfig source, Approach approach, Expression windowed) {
        if (source.shape() == MetricShape.BINOMIAL) {
            return AggregateExpression.max(windowed);
        }
        if (source.shape() == MetricShape.QUANTILE) {
            return AggregateExpression.sum(windowed);
        }
        if (approach == Approach.PREAGG) {
            if (source.aggregation() == Aggregation.COUNT_DISTINCT) {
                // rows are the unnested per-day distinct values
                return AggregateExpression.of(AggregateExpression.AggregateFunction.COUNT_DISTINCT, windowed);
            }
            return switch (source.effectiveRollup()) {
                case SUM -> AggregateExpression.sum(windowed);
                case MAX -> AggregateExpression.max(windowed);
            };
        }
        return switch (source.aggregation()) {
            case SUM -> AggregateExpression.sum(windowed);
            case COUNT -> AggregateExpression.of(AggregateExpression.AggregateFunction.COUNT, windowed);
            case COUNT_DISTINCT -> AggregateExpression.of(AggregateExpression.AggregateFunction.COUNT_DISTINCT, windowed);
            case CUSTOM -> AggregateExpression.custom(source.aggregateTemplate(), windowed);
        };
    }

    /**
     * Upper clamp of a per-user value.
     */
    public Expression capped(Expression value, Expression capValue) {
        return CaseExpression.of(ComparisonExpression.greaterThan(value, capValue), capValue, value);
    }

    /**
     * Population cap: the configured percentile of the per-user values.
     */
    public PercentileExpression capThreshold(MetricConfig metric, Expression perUserValues) {
        if (!metric.isCapped()) {
            throw new IllegalArgumentException("Metric " + metric.id() + " is not capped");
        }
        return PercentileExpression.exact(perUserValues, metric.capPercentile());
    }

    public PercentileExpression quantile(QuantileSpec spec, Expression values, boolean approximate) {
        return new PercentileExpression(values, spec.quantile(), approximate);
    }

    /**
     * Row filter dropping zero values when the quantile ignores zeros, or null.
     */
    public Expression nonZero(QuantileSpec spec, Expression value) {
        return spec.ignoreZeros() ? ComparisonExpression.notEquals(value, ZERO) : null;
    }
}
