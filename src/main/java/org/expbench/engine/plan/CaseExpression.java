package org.expbench.engine.plan;

import java.util.Objects;

/**
 * Represents a CASE WHEN expression.
 *
 * <pre>
 * CASE WHEN condition THEN thenValue ELSE elseValue END
 * </pre>
 *
 * A null else value renders without an ELSE branch, which yields SQL NULL for
 * non-matching rows. Aggregates over such expressions skip the non-matching rows.
 *
 * @param condition The condition to evaluate
 * @param thenValue The value if condition is true
 * @param elseValue The value if condition is false (may be null)
 */
public record CaseExpression(
        Expression condition,
        Expression thenValue,
        Expression elseValue) implements Expression {

    public CaseExpression {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(thenValue, "Then value cannot be null");
    }

    public static CaseExpression of(Expression condition, Expression thenValue, Expression elseValue) {
        return new CaseExpression(condition, thenValue, elseValue);
    }

    /**
     * CASE WHEN condition THEN value END
     */
    public static CaseExpression when(Expression condition, Expression thenValue) {
        return new CaseExpression(condition, thenValue, null);
    }

    public boolean hasElse() {
        return elseValue != null;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCase(this);
    }

    @Override
    public String toString() {
        return "CASE WHEN " + condition + " THEN " + thenValue
                + (elseValue != null ? " ELSE " + elseValue : "") + " END";
    }
}
