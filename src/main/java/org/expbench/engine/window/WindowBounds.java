package org.expbench.engine.window;

import org.expbench.engine.plan.CaseExpression;
import org.expbench.engine.plan.ComparisonExpression;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.plan.LogicalExpression;

import java.util.Objects;

/**
 * A resolved window.
 *
 * On-demand windows are half-open timestamp intervals {@code [start, end)}.
 * Pre-agg windows are closed date ranges {@code [start, end]}, optionally with
 * the fraction of the first day that the timestamp window actually covers.
 *
 * @param approach         Precision of the bounds
 * @param start            Inclusive start
 * @param end              Exclusive end (on-demand) or inclusive last day (pre-agg)
 * @param firstDayFraction Share of the first day inside the window, null when not weightable
 */
public record WindowBounds(
        Approach approach,
        Expression start,
        Expression end,
        Expression firstDayFraction) {

    public WindowBounds {
        Objects.requireNonNull(approach, "Approach cannot be null");
        Objects.requireNonNull(start, "Window start cannot be null");
        Objects.requireNonNull(end, "Window end cannot be null");
        if (approach == Approach.ONDEMAND && firstDayFraction != null) {
            throw new IllegalArgumentException("Timestamp windows need no first-day weighting");
        }
    }

    public static WindowBounds timestamps(Expression start, Expression end) {
        return new WindowBounds(Approach.ONDEMAND, start, end, null);
    }

    public static WindowBounds days(Expression start, Expression end, Expression firstDayFraction) {
        return new WindowBounds(Approach.PREAGG, start, end, firstDayFraction);
    }

    /**
     * Membership test for an event timestamp (on-demand) or a metric date (pre-agg).
     */
    public Expression contains(Expression point) {
        Expression upper = approach == Approach.ONDEMAND
                ? ComparisonExpression.lessThan(point, end)
                : ComparisonExpression.lessThanOrEquals(point, end);
        return LogicalExpression.and(ComparisonExpression.greaterThanOrEquals(point, start), upper);
    }

    public boolean weightable() {
        return firstDayFraction != null;
    }

    /**
     * Per-row weight: the first-day fraction on the window's first day, 1.0 on every other day.
     */
    public Expression firstDayWeight(Expression day) {
        if (!weightable()) {
            throw new IllegalStateException("Window has no first-day fraction");
        }
        return CaseExpression.of(ComparisonExpression.equals(day, start), firstDayFraction, Literal.decimal(1.0));
    }
}
