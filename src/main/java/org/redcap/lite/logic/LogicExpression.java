package org.redcap.lite.logic;

/**
 * Sealed interface representing expressions in the branching-logic AST.
 *
 * Type hierarchy:
 * LogicExpression
 * ├── ComparisonOperand (FieldRef, Literal)
 * ├── Comparison ([field] op operand)
 * └── And, Or, Not (boolean combinators)
 *
 * Trees are immutable and built once per logic string.
 */
public sealed interface LogicExpression
        permits ComparisonOperand, Comparison, And, Or, Not {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(LogicExpressionVisitor<T> visitor);
}
