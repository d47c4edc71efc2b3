package org.redcap.lite.engine.execution;

import org.redcap.lite.column.RedcapValueArray;
import org.redcap.lite.column.RowMask;
import org.redcap.lite.logic.And;
import org.redcap.lite.logic.Comparison;
import org.redcap.lite.logic.FieldRef;
import org.redcap.lite.logic.Literal;
import org.redcap.lite.logic.LogicExpression;
import org.redcap.lite.logic.LogicExpressionVisitor;
import org.redcap.lite.logic.Not;
import org.redcap.lite.logic.Or;

import java.util.Objects;

/**
 * Evaluates a logic AST against a dataset, one column operation per
 * comparison, producing a row mask.
 *
 * Comparison semantics by kind:
 * - NUMERIC: the column against the literal as a number
 * - CATEGORICAL: the column against the literal as a string
 * - FIELD: value equality between the two columns; ordering on their
 *   numeric values, false wherever either side is NaN
 */
public final class PredicateEvaluator implements LogicExpressionVisitor<RowMask> {

    private final Dataset dataset;

    public PredicateEvaluator(Dataset dataset) {
        this.dataset = Objects.requireNonNull(dataset, "Dataset cannot be null");
    }

    public RowMask evaluate(LogicExpression expression) {
        return expression.accept(this);
    }

    @Override
    public RowMask visitComparison(Comparison comparison) {
        RedcapValueArray column = dataset.column(comparison.left().columnName());
        return switch (comparison.kind()) {
            case NUMERIC -> column.compare(comparison.operator(), ((Literal) comparison.right()).numericValue());
            case CATEGORICAL -> column.compare(comparison.operator(), ((Literal) comparison.right()).value());
            case FIELD -> {
                RedcapValueArray other = dataset.column(((FieldRef) comparison.right()).columnName());
                yield comparison.operator().isOrdering()
                        ? column.compare(comparison.operator(), other.numericValues())
                        : column.compare(comparison.operator(), other);
            }
        };
    }

    @Override
    public RowMask visitAnd(And and) {
        RowMask result = null;
        for (LogicExpression operand : and.operands()) {
            RowMask mask = operand.accept(this);
            result = result == null ? mask : result.and(mask);
        }
        return result;
    }

    @Override
    public RowMask visitOr(Or or) {
        RowMask result = null;
        for (LogicExpression operand : or.operands()) {
            RowMask mask = operand.accept(this);
            result = result == null ? mask : result.or(mask);
        }
        return result;
    }

    @Override
    public RowMask visitNot(Not not) {
        return not.operand().accept(this).not();
    }

    @Override
    public RowMask visitField(FieldRef field) {
        throw new IllegalStateException("A field reference is not a predicate: " + field);
    }

    @Override
    public RowMask visitLiteral(Literal literal) {
        throw new IllegalStateException("A literal is not a predicate: " + literal);
    }
}
