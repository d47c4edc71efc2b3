package org.redcap.lite.logic;

import java.util.List;
import java.util.Objects;

/**
 * Disjunction of two or more expressions.
 *
 * @param operands The operands, in source order
 */
public record Or(List<LogicExpression> operands) implements LogicExpression {

    public Or {
        Objects.requireNonNull(operands, "Operands cannot be null");
        operands = List.copyOf(operands);
        if (operands.size() < 2) {
            throw new IllegalArgumentException("OR requires at least 2 operands");
        }
    }

    public static Or of(LogicExpression... operands) {
        return new Or(List.of(operands));
    }

    @Override
    public <T> T accept(LogicExpressionVisitor<T> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public String toString() {
        return "(" + String.join(" OR ", operands.stream().map(Object::toString).toList()) + ")";
    }
}
