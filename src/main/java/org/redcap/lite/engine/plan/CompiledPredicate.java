package org.redcap.lite.engine.plan;

import org.redcap.lite.column.RowMask;
import org.redcap.lite.engine.execution.Dataset;
import org.redcap.lite.engine.execution.PredicateEvaluator;
import org.redcap.lite.engine.execution.UnknownFieldException;
import org.redcap.lite.logic.LogicExpression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A translated branching-logic string, ready to evaluate against datasets.
 * Immutable and safe to share between threads.
 *
 * @param logic            The source logic string
 * @param expression       The logic AST
 * @param referencedFields The export column names the expression reads
 */
public record CompiledPredicate(
        String logic,
        LogicExpression expression,
        Set<String> referencedFields) {

    public CompiledPredicate {
        Objects.requireNonNull(logic, "Logic cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(referencedFields, "Referenced fields cannot be null");
        referencedFields = Collections.unmodifiableSet(new LinkedHashSet<>(referencedFields));
    }

    /**
     * Evaluates the predicate row by row.
     *
     * @return one entry per dataset row, true where the logic holds
     * @throws UnknownFieldException if the dataset lacks a referenced field;
     *                               checked before any column is read
     */
    public RowMask evaluate(Dataset dataset) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String field : referencedFields) {
            if (!dataset.hasField(field)) {
                unknown.add(field);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownFieldException(unknown);
        }
        return new PredicateEvaluator(dataset).evaluate(expression);
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
