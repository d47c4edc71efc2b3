package org.redcap.lite.types;

import java.util.Objects;

/**
 * A single REDCap response value.
 *
 * REDCap stores every response as a string but lets it take part in
 * comparisons and arithmetic as a string or as a number depending on the
 * other operand. This type reproduces that behaviour:
 *
 * <pre>
 * value("1")   .eq(1)      => true
 * value("1")   .eq("1.0")  => false
 * value("1.0") .eq(1)      => true
 * value("")    .eq(0)      => true
 * value("")    .eq("0")    => false
 * value("2")   .lt("13")   => false   (lexicographic)
 * value("2")   .lt(13)     => true    (numeric)
 * </pre>
 *
 * Operands may be another {@code RedcapValue}, a {@link String} or a
 * {@link Number}; anything else raises {@link InputTypeException}. Semantic
 * edge cases never raise: they degrade to false or NaN.
 *
 * Instances are immutable. {@link #equals(Object)} is Java value equality on
 * the raw string and category; REDCap equality is {@link #eq(Object)}.
 */
public final class RedcapValue {

    /**
     * The empty response. Independent of any configuration.
     */
    public static final RedcapValue MISSING = new RedcapValue("", ValueClassifier.Classification.MISSING);

    private final String rawString;
    private final double numericValue;
    private final Category category;

    RedcapValue(String rawString, ValueClassifier.Classification classification) {
        this.rawString = Objects.requireNonNull(rawString, "Raw string cannot be null");
        this.numericValue = classification.numericValue();
        this.category = classification.category();
    }

    /**
     * Rebuilds a value from an already known classification, e.g. an element
     * of a column.
     *
     * @throws IllegalArgumentException if a MISSING classification comes with
     *                                  a non-empty raw string
     */
    public static RedcapValue of(String rawString, ValueClassifier.Classification classification) {
        Objects.requireNonNull(classification, "Classification cannot be null");
        if (classification.category() == Category.MISSING) {
            if (rawString != null && !rawString.isEmpty()) {
                throw new IllegalArgumentException("MISSING values must have an empty raw string");
            }
            return MISSING;
        }
        return new RedcapValue(rawString, classification);
    }

    public String rawString() {
        return rawString;
    }

    public double numericValue() {
        return numericValue;
    }

    public Category category() {
        return category;
    }

    public boolean isMissing() {
        return category == Category.MISSING;
    }

    public boolean isTextual() {
        return category.isTextual();
    }

    // ========================================
    // Comparison
    // ========================================

    public boolean compare(ComparisonOperator op, Object other) {
        Objects.requireNonNull(op, "Operator cannot be null");
        return ValueSemantics.compare(category, rawString, numericValue, op, Operand.of(other, op.symbol()));
    }

    public boolean eq(Object other) {
        return compare(ComparisonOperator.EQUALS, other);
    }

    public boolean ne(Object other) {
        return compare(ComparisonOperator.NOT_EQUALS, other);
    }

    public boolean lt(Object other) {
        return compare(ComparisonOperator.LESS_THAN, other);
    }

    public boolean le(Object other) {
        return compare(ComparisonOperator.LESS_THAN_OR_EQUALS, other);
    }

    public boolean gt(Object other) {
        return compare(ComparisonOperator.GREATER_THAN, other);
    }

    public boolean ge(Object other) {
        return compare(ComparisonOperator.GREATER_THAN_OR_EQUALS, other);
    }

    // ========================================
    // Arithmetic
    // ========================================

    public double calculate(ArithmeticOperator op, Object other) {
        Objects.requireNonNull(op, "Operator cannot be null");
        return ValueSemantics.calculate(category, numericValue, op, Operand.of(other, op.symbol()));
    }

    public double add(Object other) {
        return calculate(ArithmeticOperator.ADD, other);
    }

    public double sub(Object other) {
        return calculate(ArithmeticOperator.SUBTRACT, other);
    }

    public double mul(Object other) {
        return calculate(ArithmeticOperator.MULTIPLY, other);
    }

    public double div(Object other) {
        return calculate(ArithmeticOperator.DIVIDE, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RedcapValue other)) {
            return false;
        }
        return category == other.category && rawString.equals(other.rawString);
    }

    @Override
    public int hashCode() {
        return rawString.hashCode();
    }

    /**
     * @return the raw string, exactly as stored
     */
    @Override
    public String toString() {
        return rawString;
    }
}
