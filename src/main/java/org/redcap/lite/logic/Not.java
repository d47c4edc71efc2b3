package org.redcap.lite.logic;

import java.util.Objects;

/**
 * Negation, written {@code !( ... )}.
 *
 * @param operand The negated expression
 */
public record Not(LogicExpression operand) implements LogicExpression {

    public Not {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public <T> T accept(LogicExpressionVisitor<T> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        if (operand instanceof And || operand instanceof Or) {
            return "!" + operand;
        }
        return "!(" + operand + ")";
    }
}
