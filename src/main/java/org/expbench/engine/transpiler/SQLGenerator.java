package org.expbench.engine.transpiler;

import org.expbench.engine.plan.*;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders expression trees into dialect-specific SQL text.
 *
 * Every engine difference is delegated to the {@link SQLDialect}; the generator
 * itself only knows the shape of each expression. Output is deterministic: the
 * same tree and dialect always produce byte-identical text.
 */
public final class SQLGenerator implements ExpressionVisitor<String> {

    private final SQLDialect dialect;

    public SQLGenerator(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Generates SQL from an expression.
     *
     * @param expression The expression to generate SQL for
     * @return The generated SQL string
     */
    public String generate(Expression expression) {
        return expression.accept(this);
    }

    public String quote(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    @Override
    public String visitColumnReference(ColumnReference columnRef) {
        if (columnRef.tableAlias().isEmpty()) {
            return dialect.quoteIdentifier(columnRef.columnName());
        }
        return columnRef.tableAlias() + "." + dialect.quoteIdentifier(columnRef.columnName());
    }

    @Override
    public String visitLiteral(Literal literal) {
        return switch (literal.literalType()) {
            case STRING -> dialect.quoteStringLiteral((String) literal.value());
            case INTEGER, DECIMAL -> literal.numericText();
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case NULL -> dialect.formatNull();
            case DATE -> "DATE " + dialect.quoteStringLiteral((String) literal.value());
            case TIMESTAMP -> "TIMESTAMP " + dialect.quoteStringLiteral((String) literal.value());
        };
    }

    @Override
    public String visitComparison(ComparisonExpression comparison) {
        String left = comparison.left().accept(this);
        String op = comparison.operator().toSql();

        // IS NOT NULL has no right operand
        if (comparison.operator().isUnary()) {
            return left + " " + op;
        }

        String right = comparison.right().accept(this);
        return left + " " + op + " " + right;
    }

    @Override
    public String visitLogical(LogicalExpression logical) {
        return logical.operands().stream()
                .map(e -> e.accept(this))
                .collect(Collectors.joining(" " + logical.operator() + " ", "(", ")"));
    }

    @Override
    public String visitCase(CaseExpression caseExpr) {
        var sb = new StringBuilder();
        sb.append("CASE");

        // Flatten nested CASE expressions for cleaner SQL
        appendCaseWhen(sb, caseExpr);

        sb.append(" END");
        return sb.toString();
    }

    private void appendCaseWhen(StringBuilder sb, CaseExpression caseExpr) {
        sb.append(" WHEN ");
        sb.append(caseExpr.condition().accept(this));
        sb.append(" THEN ");
        sb.append(caseExpr.thenValue().accept(this));

        if (caseExpr.elseValue() instanceof CaseExpression nested) {
            appendCaseWhen(sb, nested);
        } else if (caseExpr.hasElse()) {
            sb.append(" ELSE ");
            sb.append(caseExpr.elseValue().accept(this));
        }
    }

    @Override
    public String visitArithmetic(ArithmeticExpression arithmetic) {
        String left = arithmetic.left().accept(this);
        String right = arithmetic.right().accept(this);
        return "(" + left + " " + arithmetic.operator().symbol() + " " + right + ")";
    }

    @Override
    public String visitAggregate(AggregateExpression aggregate) {
        String arg = aggregate.argument().accept(this);
        return switch (aggregate.function()) {
            case COUNT_DISTINCT -> aggregate.function().sql() + " " + arg + ")"; // COUNT(DISTINCT col)
            case CUSTOM -> aggregate.template().replace(AggregateExpression.VALUE_PLACEHOLDER, arg);
            default -> aggregate.function().sql() + "(" + arg + ")";
        };
    }

    @Override
    public String visitPercentile(PercentileExpression percentile) {
        String arg = percentile.argument().accept(this);
        String q = Literal.decimal(percentile.quantile()).numericText();
        return percentile.approximate()
                ? dialect.approxPercentile(arg, q)
                : dialect.percentile(arg, q);
    }

    @Override
    public String visitFunctionCall(SqlFunctionCall functionCall) {
        String funcName = functionCall.functionName();
        String target = functionCall.target().accept(this);

        if (functionCall.arguments().isEmpty()) {
            return funcName + "(" + target + ")";
        }
        String args = functionCall.arguments().stream()
                .map(e -> e.accept(this))
                .collect(Collectors.joining(", "));
        return funcName + "(" + target + ", " + args + ")";
    }

    @Override
    public String visitCast(CastExpression cast) {
        String source = cast.source().accept(this);
        if (cast.isDateCast()) {
            return dialect.castToDate(source);
        }
        String type = CastExpression.DOUBLE.equalsIgnoreCase(cast.targetType())
                ? dialect.doubleType()
                : cast.targetType();
        return "CAST(" + source + " AS " + type + ")";
    }

    @Override
    public String visitDateAdjust(DateAdjustExpression adjust) {
        return dialect.adjust(adjust.date().accept(this), adjust.amount(), adjust.unit());
    }

    @Override
    public String visitDatePart(DatePartExpression datePart) {
        String source = datePart.source().accept(this);
        return switch (datePart.part()) {
            case HOUR -> dialect.extractHour(source);
        };
    }

    @Override
    public String visitRawSql(RawSqlExpression raw) {
        return "(" + raw.sql() + ")";
    }
}
