package org.redcap.lite.logic;

import org.redcap.lite.types.ComparisonOperator;

import java.util.Objects;

/**
 * A comparison of a field against a literal or another field.
 *
 * @param left     The field being tested
 * @param operator The comparison operator
 * @param right    The literal or field compared against
 * @param kind     The comparison semantics, inferred from {@code right}
 */
public record Comparison(
        FieldRef left,
        ComparisonOperator operator,
        ComparisonOperand right,
        ComparisonKind kind) implements LogicExpression {

    public Comparison {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        if (kind != ComparisonKind.infer(right)) {
            throw new IllegalArgumentException("Kind " + kind + " does not match operand " + right);
        }
    }

    /**
     * Builds a comparison, inferring its kind from the right operand.
     */
    public static Comparison of(FieldRef left, ComparisonOperator operator, ComparisonOperand right) {
        return new Comparison(left, operator, right, ComparisonKind.infer(right));
    }

    @Override
    public <T> T accept(LogicExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
