package org.expbench.engine.plan;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Represents a literal value in an expression tree.
 *
 * @param value       The literal value (can be null)
 * @param literalType The type of the literal
 */
public record Literal(
        Object value,
        LiteralType literalType) implements Expression {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public enum LiteralType {
        STRING,
        INTEGER,
        DECIMAL,
        BOOLEAN,
        NULL,
        DATE,
        TIMESTAMP
    }

    public Literal {
        Objects.requireNonNull(literalType, "Literal type cannot be null");

        if (value != null) {
            switch (literalType) {
                case STRING, DATE, TIMESTAMP -> {
                    if (!(value instanceof String)) {
                        throw new IllegalArgumentException(literalType + " literal must have String value");
                    }
                }
                case INTEGER, DECIMAL -> {
                    if (!(value instanceof Number)) {
                        throw new IllegalArgumentException(literalType + " literal must have Number value");
                    }
                }
                case BOOLEAN -> {
                    if (!(value instanceof Boolean)) {
                        throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                    }
                }
                case NULL -> throw new IllegalArgumentException("NULL literal cannot have a value");
            }
        }
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal decimal(double value) {
        return new Literal(value, LiteralType.DECIMAL);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal nullValue() {
        return new Literal(null, LiteralType.NULL);
    }

    /**
     * Factory for DATE literals, rendered as {@code DATE 'yyyy-MM-dd'}.
     */
    public static Literal date(LocalDate value) {
        return new Literal(value.toString(), LiteralType.DATE);
    }

    /**
     * Factory for TIMESTAMP literals, rendered as {@code TIMESTAMP 'yyyy-MM-dd HH:mm:ss'}.
     */
    public static Literal timestamp(LocalDateTime value) {
        return new Literal(value.format(TIMESTAMP_FORMAT), LiteralType.TIMESTAMP);
    }

    /**
     * Stable textual form of a numeric literal. Doubles go through BigDecimal so
     * that the same value always renders to the same text.
     */
    public String numericText() {
        if (value instanceof Double d) {
            return BigDecimal.valueOf(d).toPlainString();
        }
        return String.valueOf(value);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return switch (literalType) {
            case NULL -> "NULL";
            case STRING -> "'" + value + "'";
            case DATE -> "DATE '" + value + "'";
            case TIMESTAMP -> "TIMESTAMP '" + value + "'";
            default -> numericText();
        };
    }
}
