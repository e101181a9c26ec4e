package org.expbench.engine.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnRef);

    T visitLiteral(Literal literal);

    T visitComparison(ComparisonExpression comparison);

    T visitLogical(LogicalExpression logical);

    T visitCase(CaseExpression caseExpr);

    T visitArithmetic(ArithmeticExpression arithmetic);

    T visitAggregate(AggregateExpression aggregate);

    /**
     * Visit a percentile aggregate (exact or approximate).
     */
    T visitPercentile(PercentileExpression percentile);

    T visitFunctionCall(SqlFunctionCall functionCall);

    T visitCast(CastExpression cast);

    /**
     * Visit a date/timestamp shift by a whole number of units.
     */
    T visitDateAdjust(DateAdjustExpression adjust);

    T visitDatePart(DatePartExpression datePart);

    T visitRawSql(RawSqlExpression raw);
}
