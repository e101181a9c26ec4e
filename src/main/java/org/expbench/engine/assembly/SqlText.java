package org.expbench.engine.assembly;

import org.expbench.engine.plan.ColumnReference;
import org.expbench.engine.plan.Expression;
import org.expbench.engine.plan.Literal;
import org.expbench.engine.transpiler.SQLGenerator;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Small text helpers over a {@link SQLGenerator}, shared by the stage builders.
 * Stage names are bare; every column identifier goes through the dialect's quoting.
 */
final class SqlText {

    private final SQLGenerator generator;

    SqlText(SQLGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "Generator cannot be null");
    }

    String sql(Expression expression) {
        return generator.generate(expression);
    }

    String id(String identifier) {
        return generator.quote(identifier);
    }

    String col(String alias, String column) {
        return sql(ColumnReference.of(alias, column));
    }

    String as(Expression expression, String alias) {
        return sql(expression) + " AS " + id(alias);
    }

    String as(String renderedExpression, String alias) {
        return renderedExpression + " AS " + id(alias);
    }

    String string(String value) {
        return sql(Literal.string(value));
    }

    String table(String table, String alias) {
        return id(table) + " " + alias;
    }

    static String where(List<String> conditions) {
        if (conditions.isEmpty()) {
            return "";
        }
        return "\nWHERE " + String.join("\n  AND ", conditions);
    }

    static String list(List<String> items) {
        return items.stream().collect(Collectors.joining(", "));
    }
}
