package org.redcap.lite.logic;

import java.util.List;
import java.util.Objects;

/**
 * Conjunction of two or more expressions.
 *
 * @param operands The operands, in source order
 */
public record And(List<LogicExpression> operands) implements LogicExpression {

    public And {
        Objects.requireNonNull(operands, "Operands cannot be null");
        operands = List.copyOf(operands);
        if (operands.size() < 2) {
            throw new IllegalArgumentException("AND requires at least 2 operands");
        }
    }

    public static And of(LogicExpression... operands) {
        return new And(List.of(operands));
    }

    @Override
    public <T> T accept(LogicExpressionVisitor<T> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return "(" + String.join(" AND ", operands.stream().map(Object::toString).toList()) + ")";
    }
}
