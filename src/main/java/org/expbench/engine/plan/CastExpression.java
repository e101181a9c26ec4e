package org.expbench.engine.plan;

import java.util.Objects;

/**
 * CAST expression: CAST(expr AS targetType).
 * DATE casts are the flooring step of day-precision windows. DATE and DOUBLE
 * target types are resolved through the dialect.
 */
public record CastExpression(Expression source, String targetType) implements Expression {

    public static final String DATE = "DATE";
    public static final String DOUBLE = "DOUBLE";

    public CastExpression {
        Objects.requireNonNull(source, "Cast source cannot be null");
        Objects.requireNonNull(targetType, "Cast target type cannot be null");
    }

    public static CastExpression toDate(Expression source) {
        return new CastExpression(source, DATE);
    }

    public static CastExpression toDouble(Expression source) {
        return new CastExpression(source, DOUBLE);
    }

    public boolean isDateCast() {
        return DATE.equalsIgnoreCase(targetType);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCast(this);
    }
}
