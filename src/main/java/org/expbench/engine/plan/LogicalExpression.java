package org.expbench.engine.plan;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Represents a conjunction of conditions.
 *
 * @param operator The logical operator
 * @param operands The operand expressions
 */
public record LogicalExpression(
        LogicalOperator operator,
        List<Expression> operands) implements Expression {

    public enum LogicalOperator {
        AND
    }

    public LogicalExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operands, "Operands cannot be null");

        operands = List.copyOf(operands);

        if (operands.size() < 2) {
            throw new IllegalArgumentException(operator + " operator requires at least 2 operands");
        }
    }

    public static LogicalExpression and(Expression... expressions) {
        return new LogicalExpression(LogicalOperator.AND, List.of(expressions));
    }

    public static LogicalExpression and(List<Expression> expressions) {
        return new LogicalExpression(LogicalOperator.AND, expressions);
    }

    /**
     * ANDs the given conditions, collapsing to the single condition when only one is present.
     */
    public static Expression allOf(List<Expression> conditions) {
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("At least one condition is required");
        }
        return conditions.size() == 1 ? conditions.get(0) : and(conditions);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public String toString() {
        return operands.stream().map(Object::toString)
                .collect(Collectors.joining(" " + operator + " ", "(", ")"));
    }
}
