package org.redcap.lite.logic;

/**
 * How a comparison treats the column it reads, inferred from the right-hand
 * operand.
 */
public enum ComparisonKind {
    /** {@code [f] op 5}: numeric equality and ordering. */
    NUMERIC,
    /** {@code [f] op '5'}: exact raw-string equality, lexicographic ordering. */
    CATEGORICAL,
    /** {@code [f] op [g]}: value equality, numeric ordering. */
    FIELD;

    public static ComparisonKind infer(ComparisonOperand right) {
        if (right instanceof FieldRef) {
            return FIELD;
        }
        return ((Literal) right).kind() == Literal.Kind.NUMBER ? NUMERIC : CATEGORICAL;
    }
}
