package org.redcap.lite.column;

/**
 * Thrown when a bulk operation receives operands of unequal length.
 */
public class ValueMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public ValueMismatchException(String operation, int expected, int actual) {
        super(operation + " requires operands of equal length, expected " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
