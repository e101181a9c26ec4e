package org.expbench.engine.plan;

import java.util.Objects;

/**
 * Represents a reference to a column in a query stage.
 *
 * @param tableAlias The alias of the relation containing the column (may be empty)
 * @param columnName The column name
 */
public record ColumnReference(
        String tableAlias,
        String columnName) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableAlias, "Table alias cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");
    }

    public static ColumnReference of(String tableAlias, String columnName) {
        return new ColumnReference(tableAlias, columnName);
    }

    /**
     * Creates a column reference without a table alias.
     */
    public static ColumnReference of(String columnName) {
        return new ColumnReference("", columnName);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return tableAlias.isEmpty() ? columnName : tableAlias + "." + columnName;
    }
}
