package org.redcap.lite.logic;

/**
 * Exception thrown when a branching-logic string does not match the grammar.
 * Includes optional source location information.
 */
public class LogicParseException extends RuntimeException {

    private final int line;
    private final int column;

    public LogicParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public LogicParseException(String message, int line, int column) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
