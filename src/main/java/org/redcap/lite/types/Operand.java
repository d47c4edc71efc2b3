package org.redcap.lite.types;

/**
 * A scalar operand of a comparison or arithmetic call, resolved from an
 * arbitrary object once so the semantic rules can switch over a closed set.
 *
 * Hierarchy:
 * Operand
 * ├── ValueOperand (another response value)
 * ├── TextOperand (a plain string, compared as-is)
 * └── NumberOperand (a Java number)
 */
public sealed interface Operand permits Operand.ValueOperand, Operand.TextOperand, Operand.NumberOperand {

    record ValueOperand(RedcapValue value) implements Operand {
    }

    record TextOperand(String text) implements Operand {
    }

    record NumberOperand(double number) implements Operand {
    }

    /**
     * Resolves a scalar operand.
     *
     * @param operand   a {@link RedcapValue}, {@link String} or {@link Number}
     * @param operation the operation name, for the error message
     * @throws InputTypeException for any other type, including null
     */
    static Operand of(Object operand, String operation) {
        if (operand instanceof RedcapValue value) {
            return new ValueOperand(value);
        }
        if (operand instanceof String text) {
            return new TextOperand(text);
        }
        if (operand instanceof Number number) {
            return new NumberOperand(number.doubleValue());
        }
        throw InputTypeException.unsupportedOperand(operation, operand);
    }

    /**
     * @return true if the object would resolve to a scalar operand
     */
    static boolean isScalar(Object operand) {
        return operand instanceof RedcapValue || operand instanceof String || operand instanceof Number;
    }

    /**
     * Numeric view used by arithmetic: textual values and unparsable strings
     * are NaN, MISSING is 0.0.
     */
    default double arithmeticValue() {
        if (this instanceof ValueOperand v) {
            return v.value().numericValue();
        }
        if (this instanceof TextOperand t) {
            return ValueClassifier.parseNumber(t.text());
        }
        return ((NumberOperand) this).number();
    }
}
