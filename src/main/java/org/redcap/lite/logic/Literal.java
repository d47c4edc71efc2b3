package org.redcap.lite.logic;

import java.util.Objects;

/**
 * A literal in branching logic.
 *
 * @param value The literal text, without quotes
 * @param kind  Whether it was written as a bare number or quoted
 */
public record Literal(String value, Kind kind) implements ComparisonOperand {

    public enum Kind {
        /** A bare signed number: compared numerically. */
        NUMBER,
        /** Quoted text: compared by exact string match or lexicographically. */
        STRING
    }

    public Literal {
        Objects.requireNonNull(value, "Literal value cannot be null");
        Objects.requireNonNull(kind, "Literal kind cannot be null");
        if (kind == Kind.NUMBER) {
            try {
                Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("NUMBER literal must be numeric: " + value, e);
            }
        }
    }

    public static Literal number(String value) {
        return new Literal(value, Kind.NUMBER);
    }

    public static Literal string(String value) {
        return new Literal(value, Kind.STRING);
    }

    public double numericValue() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Not a NUMBER literal: " + this);
        }
        return Double.parseDouble(value);
    }

    @Override
    public <T> T accept(LogicExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "'" + value + "'" : value;
    }
}
