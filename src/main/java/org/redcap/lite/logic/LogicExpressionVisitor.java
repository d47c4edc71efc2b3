package org.redcap.lite.logic;

/**
 * Visitor interface for traversing LogicExpression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface LogicExpressionVisitor<T> {

    T visitField(FieldRef field);

    T visitLiteral(Literal literal);

    T visitComparison(Comparison comparison);

    T visitAnd(And and);

    T visitOr(Or or);

    T visitNot(Not not);
}
