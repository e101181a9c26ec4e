package org.expbench.engine.plan;

import java.util.Objects;

/**
 * A SQL fragment taken verbatim from configuration (metric value expressions,
 * metric/segment/activation predicates). Rendered in parentheses.
 *
 * @param sql The fragment text
 */
public record RawSqlExpression(String sql) implements Expression {

    public RawSqlExpression {
        Objects.requireNonNull(sql, "SQL fragment cannot be null");
        if (sql.isBlank()) {
            throw new IllegalArgumentException("SQL fragment cannot be blank");
        }
    }

    public static RawSqlExpression of(String sql) {
        return new RawSqlExpression(sql.strip());
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitRawSql(this);
    }

    @Override
    public String toString() {
        return "(" + sql + ")";
    }
}
