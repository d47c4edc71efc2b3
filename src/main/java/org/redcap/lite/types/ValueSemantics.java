package org.redcap.lite.types;

import org.redcap.lite.types.Operand.NumberOperand;
import org.redcap.lite.types.Operand.TextOperand;
import org.redcap.lite.types.Operand.ValueOperand;

/**
 * The element-level truth table of REDCap response values.
 *
 * Both {@link RedcapValue} and the columnar array evaluate through these
 * methods, one element at a time, so the scalar and vectorized paths cannot
 * drift apart.
 */
public final class ValueSemantics {

    private ValueSemantics() {
        // Static utility class
    }

    /**
     * Evaluates {@code element op operand} for one element described by its
     * category, raw string and numeric value.
     */
    public static boolean compare(Category category, String raw, double numeric,
            ComparisonOperator op, Operand operand) {
        return switch (op) {
            case EQUALS -> isEqual(category, raw, numeric, operand);
            case NOT_EQUALS -> !isEqual(category, raw, numeric, operand);
            default -> isOrdered(category, raw, numeric, op, operand);
        };
    }

    /**
     * REDCap equality.
     *
     * MISSING equals another missing value, "" or 0, but not "0": string
     * operands are never coerced. Other categories compare raw strings against
     * values and strings, and only NUMBER can equal a number.
     */
    public static boolean isEqual(Category category, String raw, double numeric, Operand operand) {
        switch (category) {
            case MISSING:
                if (operand instanceof ValueOperand v) {
                    RedcapValue other = v.value();
                    return other.category() == Category.MISSING
                            || other.rawString().isEmpty()
                            || other.numericValue() == 0.0;
                }
                if (operand instanceof TextOperand t) {
                    return t.text().isEmpty();
                }
                return ((NumberOperand) operand).number() == 0.0;
            case NUMBER:
                if (operand instanceof NumberOperand n) {
                    return numeric == n.number();
                }
                return raw.equals(rawOf(operand));
            default:
                if (operand instanceof NumberOperand) {
                    return false;
                }
                return raw.equals(rawOf(operand));
        }
    }

    /**
     * REDCap ordering: lexicographic against values and strings, numeric
     * against numbers. A textual element never orders against a number.
     */
    public static boolean isOrdered(Category category, String raw, double numeric,
            ComparisonOperator op, Operand operand) {
        if (operand instanceof NumberOperand n) {
            return !category.isTextual() && op.testOrder(numeric, n.number());
        }
        return op.testOrder(raw.compareTo(rawOf(operand)));
    }

    /**
     * REDCap arithmetic over numeric views; NaN propagates and division by
     * zero is NaN.
     */
    public static double calculate(Category category, double numeric, ArithmeticOperator op, Operand operand) {
        if (category.isTextual()) {
            return Double.NaN;
        }
        return op.apply(numeric, operand.arithmeticValue());
    }

    private static String rawOf(Operand operand) {
        if (operand instanceof ValueOperand v) {
            return v.value().rawString();
        }
        return ((TextOperand) operand).text();
    }
}
