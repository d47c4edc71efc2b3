package org.redcap.lite.logic;

/**
 * The right-hand side of a comparison: another field or a literal.
 */
public sealed interface ComparisonOperand extends LogicExpression permits FieldRef, Literal {
}
