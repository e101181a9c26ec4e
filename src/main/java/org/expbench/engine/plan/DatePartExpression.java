package org.expbench.engine.plan;

import java.util.Objects;

/**
 * Extracts a calendar field from a timestamp.
 *
 * @param part   The field to extract
 * @param source The timestamp expression
 */
public record DatePartExpression(DatePart part, Expression source) implements Expression {

    public enum DatePart {
        HOUR
    }

    public DatePartExpression {
        Objects.requireNonNull(part, "Date part cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
    }

    public static DatePartExpression hour(Expression source) {
        return new DatePartExpression(DatePart.HOUR, source);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitDatePart(this);
    }
}
