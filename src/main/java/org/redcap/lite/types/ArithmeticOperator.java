package org.redcap.lite.types;

/**
 * Arithmetic operators over the numeric view of response values.
 */
public enum ArithmeticOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Applies the operator. Division by zero yields NaN rather than an
     * infinity, matching REDCap's calculated fields.
     */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> right == 0.0 ? Double.NaN : left / right;
        };
    }
}
