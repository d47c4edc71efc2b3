package org.redcap.lite.column;

import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.Arrays;

/**
 * An immutable boolean vector, one entry per row, produced by column
 * comparisons and predicate evaluation.
 */
public final class RowMask {

    private final boolean[] bits;

    private RowMask(boolean[] bits) {
        this.bits = bits;
    }

    public static RowMask of(boolean... bits) {
        return new RowMask(bits.clone());
    }

    /**
     * @return a mask of the given size with every entry set to value
     */
    public static RowMask filled(int size, boolean value) {
        boolean[] bits = new boolean[size];
        if (value) {
            Arrays.fill(bits, true);
        }
        return new RowMask(bits);
    }

    /**
     * Wraps an array the caller no longer touches.
     */
    static RowMask wrap(boolean[] bits) {
        return new RowMask(bits);
    }

    public int size() {
        return bits.length;
    }

    public boolean get(int row) {
        return bits[row];
    }

    public RowMask and(RowMask other) {
        checkSize("and", other);
        boolean[] result = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            result[i] = bits[i] && other.bits[i];
        }
        return new RowMask(result);
    }

    public RowMask or(RowMask other) {
        checkSize("or", other);
        boolean[] result = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            result[i] = bits[i] || other.bits[i];
        }
        return new RowMask(result);
    }

    public RowMask not() {
        boolean[] result = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            result[i] = !bits[i];
        }
        return new RowMask(result);
    }

    /**
     * @return the number of selected rows
     */
    public int count() {
        int count = 0;
        for (boolean bit : bits) {
            if (bit) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return the positions of the selected rows, ascending
     */
    public ImmutableIntList selectedIndices() {
        MutableIntList indices = IntLists.mutable.empty();
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                indices.add(i);
            }
        }
        return indices.toImmutable();
    }

    public boolean[] toArray() {
        return bits.clone();
    }

    private void checkSize(String operation, RowMask other) {
        if (other.bits.length != bits.length) {
            throw new ValueMismatchException("RowMask." + operation, bits.length, other.bits.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RowMask other && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(bits.length + 9);
        sb.append("RowMask[");
        for (boolean bit : bits) {
            sb.append(bit ? '1' : '0');
        }
        return sb.append(']').toString();
    }
}
