package org.redcap.lite.column;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.redcap.lite.types.ArithmeticOperator;
import org.redcap.lite.types.Category;
import org.redcap.lite.types.ComparisonOperator;
import org.redcap.lite.types.InputTypeException;
import org.redcap.lite.types.Operand;
import org.redcap.lite.types.RedcapValue;
import org.redcap.lite.types.RedcapValues;
import org.redcap.lite.types.ValueClassifier.Classification;
import org.redcap.lite.types.ValueSemantics;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * A column of REDCap response values.
 *
 * Values are stored as three parallel arrays (numeric value, raw string,
 * category) of equal length. Every operation evaluates the scalar truth
 * table of {@link RedcapValue} element by element and returns a new array
 * or a {@link RowMask}; instances are never modified.
 *
 * Operands of the bulk operations:
 * <ul>
 * <li>a scalar ({@link RedcapValue}, {@link String}, {@link Number}), broadcast
 * to every element</li>
 * <li>another {@code RedcapValueArray}, element by element</li>
 * <li>a {@link List} of scalars, element by element</li>
 * <li>a {@code double[]}, compared numerically element by element</li>
 * </ul>
 * Non-scalar operands must have the same length
 * ({@link ValueMismatchException}); any other type raises
 * {@link InputTypeException}.
 */
public final class RedcapValueArray {

    /**
     * Raw string of an arithmetic result that could not be computed.
     */
    public static final String CALC_ERROR = "$$CALC_ERR";

    private static final RedcapValueArray EMPTY = new RedcapValueArray(new double[0], new String[0], new Category[0]);

    private final double[] numericValues;
    private final String[] rawStrings;
    private final Category[] categories;

    private RedcapValueArray(double[] numericValues, String[] rawStrings, Category[] categories) {
        if (rawStrings.length != numericValues.length || categories.length != numericValues.length) {
            throw new IllegalStateException("Parallel arrays out of sync: " + numericValues.length + "/"
                    + rawStrings.length + "/" + categories.length);
        }
        this.numericValues = numericValues;
        this.rawStrings = rawStrings;
        this.categories = categories;
    }

    // ========================================
    // Construction
    // ========================================

    public static RedcapValueArray empty() {
        return EMPTY;
    }

    /**
     * Classifies raw strings with the default configuration.
     */
    public static RedcapValueArray of(List<String> rawValues) {
        return of(rawValues, RedcapValues.defaults());
    }

    /**
     * Classifies raw strings with the given value factory.
     *
     * @throws InputTypeException if any element is null
     */
    public static RedcapValueArray of(List<String> rawValues, RedcapValues values) {
        Objects.requireNonNull(rawValues, "Raw values cannot be null");
        int size = rawValues.size();
        double[] numeric = new double[size];
        String[] raw = new String[size];
        Category[] category = new Category[size];
        int i = 0;
        for (String rawValue : rawValues) {
            RedcapValue value = values.value(rawValue);
            numeric[i] = value.numericValue();
            raw[i] = value.rawString();
            category[i] = value.category();
            i++;
        }
        return new RedcapValueArray(numeric, raw, category);
    }

    public static RedcapValueArray ofValues(List<RedcapValue> values) {
        int size = values.size();
        double[] numeric = new double[size];
        String[] raw = new String[size];
        Category[] category = new Category[size];
        for (int i = 0; i < size; i++) {
            RedcapValue value = values.get(i);
            numeric[i] = value.numericValue();
            raw[i] = value.rawString();
            category[i] = value.category();
        }
        return new RedcapValueArray(numeric, raw, category);
    }

    /**
     * Concatenates arrays, preserving their order.
     */
    public static RedcapValueArray concat(RedcapValueArray... arrays) {
        return concat(Arrays.asList(arrays));
    }

    public static RedcapValueArray concat(List<RedcapValueArray> arrays) {
        int size = 0;
        for (RedcapValueArray array : arrays) {
            size += array.size();
        }
        double[] numeric = new double[size];
        String[] raw = new String[size];
        Category[] category = new Category[size];
        int offset = 0;
        for (RedcapValueArray array : arrays) {
            int length = array.size();
            System.arraycopy(array.numericValues, 0, numeric, offset, length);
            System.arraycopy(array.rawStrings, 0, raw, offset, length);
            System.arraycopy(array.categories, 0, category, offset, length);
            offset += length;
        }
        return new RedcapValueArray(numeric, raw, category);
    }

    // ========================================
    // Access
    // ========================================

    public int size() {
        return numericValues.length;
    }

    public boolean isEmpty() {
        return numericValues.length == 0;
    }

    public RedcapValue get(int index) {
        Objects.checkIndex(index, size());
        return RedcapValue.of(rawStrings[index], new Classification(categories[index], numericValues[index]));
    }

    public String rawString(int index) {
        return rawStrings[index];
    }

    public double numericValue(int index) {
        return numericValues[index];
    }

    public Category category(int index) {
        return categories[index];
    }

    public ImmutableList<String> rawStrings() {
        return Lists.immutable.with(rawStrings);
    }

    public double[] numericValues() {
        return numericValues.clone();
    }

    public ImmutableList<Category> categories() {
        return Lists.immutable.with(categories);
    }

    /**
     * @param from inclusive start
     * @param to   exclusive end
     */
    public RedcapValueArray slice(int from, int to) {
        Objects.checkFromToIndex(from, to, size());
        return new RedcapValueArray(
                Arrays.copyOfRange(numericValues, from, to),
                Arrays.copyOfRange(rawStrings, from, to),
                Arrays.copyOfRange(categories, from, to));
    }

    /**
     * Selects elements by position.
     *
     * Without fill, negative indices count back from the end. With fill, -1
     * marks a position to fill with {@code fillValue} (MISSING when null) and
     * any other negative index is rejected.
     *
     * @throws IndexOutOfBoundsException for an index outside the array
     */
    public RedcapValueArray take(int[] indices, boolean allowFill, RedcapValue fillValue) {
        RedcapValue fill = fillValue == null ? RedcapValue.MISSING : fillValue;
        int size = size();
        double[] numeric = new double[indices.length];
        String[] raw = new String[indices.length];
        Category[] category = new Category[indices.length];
        for (int i = 0; i < indices.length; i++) {
            int index = indices[i];
            if (allowFill && index == -1) {
                numeric[i] = fill.numericValue();
                raw[i] = fill.rawString();
                category[i] = fill.category();
                continue;
            }
            if (allowFill && index < -1) {
                throw new IndexOutOfBoundsException("Index " + index + " is invalid when filling; only -1 is allowed");
            }
            int resolved = index < 0 ? size + index : index;
            if (resolved < 0 || resolved >= size) {
                throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + size);
            }
            numeric[i] = numericValues[resolved];
            raw[i] = rawStrings[resolved];
            category[i] = categories[resolved];
        }
        return new RedcapValueArray(numeric, raw, category);
    }

    public RedcapValueArray take(int[] indices) {
        return take(indices, false, null);
    }

    // ========================================
    // Detection
    // ========================================

    /**
     * @return true where the element has no numeric value (textual categories)
     */
    public RowMask isNaN() {
        boolean[] result = new boolean[size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Double.isNaN(numericValues[i]);
        }
        return RowMask.wrap(result);
    }

    public RowMask isMissing() {
        boolean[] result = new boolean[size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = categories[i] == Category.MISSING;
        }
        return RowMask.wrap(result);
    }

    // ========================================
    // Comparison
    // ========================================

    public RowMask compare(ComparisonOperator op, Object other) {
        Objects.requireNonNull(op, "Operator cannot be null");
        IntFunction<Operand> operands = elementOperands(op.symbol(), other);
        boolean[] result = new boolean[size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = ValueSemantics.compare(categories[i], rawStrings[i], numericValues[i], op, operands.apply(i));
        }
        return RowMask.wrap(result);
    }

    public RowMask eq(Object other) {
        return compare(ComparisonOperator.EQUALS, other);
    }

    public RowMask ne(Object other) {
        return compare(ComparisonOperator.NOT_EQUALS, other);
    }

    public RowMask lt(Object other) {
        return compare(ComparisonOperator.LESS_THAN, other);
    }

    public RowMask le(Object other) {
        return compare(ComparisonOperator.LESS_THAN_OR_EQUALS, other);
    }

    public RowMask gt(Object other) {
        return compare(ComparisonOperator.GREATER_THAN, other);
    }

    public RowMask ge(Object other) {
        return compare(ComparisonOperator.GREATER_THAN_OR_EQUALS, other);
    }

    // ========================================
    // Arithmetic
    // ========================================

    /**
     * Element-wise arithmetic. A textual side, a division by zero or any other
     * NaN result becomes a TEXT element with raw string {@link #CALC_ERROR};
     * MISSING combined with MISSING stays MISSING.
     */
    public RedcapValueArray calculate(ArithmeticOperator op, Object other) {
        Objects.requireNonNull(op, "Operator cannot be null");
        IntFunction<Operand> operands = elementOperands(op.symbol(), other);
        int size = size();
        double[] numeric = new double[size];
        String[] raw = new String[size];
        Category[] category = new Category[size];
        for (int i = 0; i < size; i++) {
            Operand operand = operands.apply(i);
            if (categories[i] == Category.MISSING && isMissingOperand(operand)) {
                numeric[i] = 0.0;
                raw[i] = "";
                category[i] = Category.MISSING;
                continue;
            }
            double value = ValueSemantics.calculate(categories[i], numericValues[i], op, operand);
            if (Double.isNaN(value)) {
                numeric[i] = Double.NaN;
                raw[i] = CALC_ERROR;
                category[i] = Category.TEXT;
            } else {
                numeric[i] = value;
                raw[i] = Double.toString(value);
                category[i] = Category.NUMBER;
            }
        }
        return new RedcapValueArray(numeric, raw, category);
    }

    public RedcapValueArray add(Object other) {
        return calculate(ArithmeticOperator.ADD, other);
    }

    public RedcapValueArray sub(Object other) {
        return calculate(ArithmeticOperator.SUBTRACT, other);
    }

    public RedcapValueArray mul(Object other) {
        return calculate(ArithmeticOperator.MULTIPLY, other);
    }

    public RedcapValueArray div(Object other) {
        return calculate(ArithmeticOperator.DIVIDE, other);
    }

    // ========================================
    // Operand resolution
    // ========================================

    private IntFunction<Operand> elementOperands(String operation, Object other) {
        if (Operand.isScalar(other)) {
            Operand scalar = Operand.of(other, operation);
            return i -> scalar;
        }
        if (other instanceof RedcapValueArray array) {
            checkLength(operation, array.size());
            return array::operandAt;
        }
        if (other instanceof double[] numbers) {
            checkLength(operation, numbers.length);
            return i -> new Operand.NumberOperand(numbers[i]);
        }
        if (other instanceof List<?> list) {
            checkLength(operation, list.size());
            Operand[] resolved = new Operand[list.size()];
            for (int i = 0; i < resolved.length; i++) {
                resolved[i] = Operand.of(list.get(i), operation);
            }
            return i -> resolved[i];
        }
        throw InputTypeException.unsupportedOperand(operation, other);
    }

    private Operand operandAt(int index) {
        return new Operand.ValueOperand(get(index));
    }

    private static boolean isMissingOperand(Operand operand) {
        return operand instanceof Operand.ValueOperand v && v.value().isMissing();
    }

    private void checkLength(String operation, int otherLength) {
        if (otherLength != size()) {
            throw new ValueMismatchException("RedcapValueArray " + operation, size(), otherLength);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RedcapValueArray other)) {
            return false;
        }
        return Arrays.equals(rawStrings, other.rawStrings) && Arrays.equals(categories, other.categories);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rawStrings) + Arrays.hashCode(categories);
    }

    @Override
    public String toString() {
        return "RedcapValueArray" + Arrays.toString(rawStrings);
    }
}
