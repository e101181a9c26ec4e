package org.expbench.engine.plan;

import java.util.Objects;

/**
 * Represents an aggregate over an argument expression.
 * Maps to SQL aggregate functions like SUM, COUNT, MAX.
 *
 * CUSTOM aggregates carry a template in which {@code {value}} is replaced by the
 * rendered argument, e.g. {@code COUNT(DISTINCT {value})} or {@code MAX({value})}.
 *
 * @param function The aggregate function
 * @param argument The aggregated expression
 * @param template The template for CUSTOM aggregates, null otherwise
 */
public record AggregateExpression(
        AggregateFunction function,
        Expression argument,
        String template) implements Expression {

    public static final String VALUE_PLACEHOLDER = "{value}";

    public enum AggregateFunction {
        SUM("SUM"),
        COUNT("COUNT"),
        COUNT_DISTINCT("COUNT(DISTINCT"),
        MAX("MAX"),
        MIN("MIN"),
        CUSTOM("");

        private final String sql;

        AggregateFunction(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        Objects.requireNonNull(argument, "Aggregate argument cannot be null");
        if (function == AggregateFunction.CUSTOM) {
            if (template == null || !template.contains(VALUE_PLACEHOLDER)) {
                throw new IllegalArgumentException("Custom aggregate template must contain " + VALUE_PLACEHOLDER);
            }
        }
    }

    public static AggregateExpression of(AggregateFunction function, Expression argument) {
        return new AggregateExpression(function, argument, null);
    }

    public static AggregateExpression sum(Expression argument) {
        return of(AggregateFunction.SUM, argument);
    }

    public static AggregateExpression max(Expression argument) {
        return of(AggregateFunction.MAX, argument);
    }

    public static AggregateExpression min(Expression argument) {
        return of(AggregateFunction.MIN, argument);
    }

    public static AggregateExpression custom(String template, Expression argument) {
        return new AggregateExpression(AggregateFunction.CUSTOM, argument, template);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }
}
