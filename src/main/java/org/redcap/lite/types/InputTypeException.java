package org.redcap.lite.types;

/**
 * Thrown when a raw value is not a string, or when a comparison or
 * arithmetic call receives an operand type it does not support.
 */
public class InputTypeException extends RuntimeException {

    public InputTypeException(String message) {
        super(message);
    }

    /**
     * Builds the standard message for an operand of an unsupported type.
     */
    public static InputTypeException unsupportedOperand(String operation, Object operand) {
        String typeName = operand == null ? "null" : operand.getClass().getName();
        return new InputTypeException("Unsupported operand for " + operation + ": " + typeName);
    }
}
