package org.redcap.lite.types;

/**
 * Comparison operators shared by the scalar value, the column and the logic
 * language.
 */
public enum ComparisonOperator {
    EQUALS("="),
    NOT_EQUALS("<>"),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUALS("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUALS(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the operator as written in branching logic
     */
    public String symbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this != EQUALS && this != NOT_EQUALS;
    }

    /**
     * Applies an ordering operator to the result of a {@code compareTo} call.
     */
    public boolean testOrder(int comparison) {
        return switch (this) {
            case LESS_THAN -> comparison < 0;
            case LESS_THAN_OR_EQUALS -> comparison <= 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_THAN_OR_EQUALS -> comparison >= 0;
            default -> throw new IllegalStateException(this + " is not an ordering operator");
        };
    }

    /**
     * Applies an ordering operator to two doubles. Any NaN side yields false.
     */
    public boolean testOrder(double left, double right) {
        return switch (this) {
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUALS -> left <= right;
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUALS -> left >= right;
            default -> throw new IllegalStateException(this + " is not an ordering operator");
        };
    }

    /**
     * Resolves an operator from its logic symbol. {@code !=} is accepted as an
     * alias of {@code <>}.
     *
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if ("!=".equals(symbol)) {
            return NOT_EQUALS;
        }
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }
}
