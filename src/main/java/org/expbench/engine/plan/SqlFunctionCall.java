package org.expbench.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a portable SQL function call such as COALESCE or GREATEST.
 *
 * @param functionName The SQL function name
 * @param target       The primary expression the function operates on
 * @param arguments    Additional arguments (if any)
 */
public record SqlFunctionCall(
        String functionName,
        Expression target,
        List<Expression> arguments) implements Expression {

    public SqlFunctionCall {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments = List.copyOf(arguments);
    }

    public static SqlFunctionCall of(String functionName, Expression target, Expression... args) {
        return new SqlFunctionCall(functionName, target, List.of(args));
    }

    public static SqlFunctionCall coalesce(Expression target, Expression fallback) {
        return of("COALESCE", target, fallback);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return functionName + "(" + target + (arguments.isEmpty() ? "" : ", " + arguments) + ")";
    }
}
