package org.expbench.engine.plan;

import java.util.Objects;

/**
 * Shifts a date or timestamp by a signed whole number of units.
 * Negative amounts subtract. A zero amount renders the source unchanged.
 *
 * @param date   The date or timestamp expression
 * @param amount Signed number of units
 * @param unit   HOURS for timestamps, DAYS for dates
 */
public record DateAdjustExpression(
        Expression date,
        long amount,
        DurationUnit unit) implements Expression {

    public DateAdjustExpression {
        Objects.requireNonNull(date, "Date cannot be null");
        Objects.requireNonNull(unit, "Unit cannot be null");
    }

    public static Expression hours(Expression timestamp, long amount) {
        return amount == 0 ? timestamp : new DateAdjustExpression(timestamp, amount, DurationUnit.HOURS);
    }

    public static Expression days(Expression date, long amount) {
        return amount == 0 ? date : new DateAdjustExpression(date, amount, DurationUnit.DAYS);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitDateAdjust(this);
    }
}
