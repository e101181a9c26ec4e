package org.expbench.engine.plan;

/**
 * Sealed interface representing scalar and aggregate SQL expressions.
 * Window boundaries, metric clauses and per-user aggregates are all built
 * as expression trees and rendered by a dialect-aware generator.
 *
 * Includes:
 * - ColumnReference: reference to a column of an aliased relation
 * - Literal: constant value
 * - ComparisonExpression / LogicalExpression: predicates
 * - CaseExpression / ArithmeticExpression: value shaping
 * - AggregateExpression / PercentileExpression: aggregates
 * - DateAdjustExpression / DatePartExpression / CastExpression: date handling,
 *   rendered through dialect fragments
 * - RawSqlExpression: user-configured SQL fragments (value and filter expressions)
 */
public sealed interface Expression
        permits ColumnReference, Literal, ComparisonExpression, LogicalExpression, CaseExpression,
        ArithmeticExpression, AggregateExpression, PercentileExpression, SqlFunctionCall, CastExpression,
        DateAdjustExpression, DatePartExpression, RawSqlExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
