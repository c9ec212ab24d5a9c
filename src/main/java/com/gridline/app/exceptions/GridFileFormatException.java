package com.gridline.app.exceptions;

/**
 * Thrown when persisted cell lines cannot be read back.
 * Carries the one-based line number of the offending line.
 */
public class GridFileFormatException extends RuntimeException {

    private final int line;

    public GridFileFormatException(int line, String message) {
        super("Line " + line + ": " + message);
        this.line = line;
    }

    public GridFileFormatException(int line, String message, Throwable cause) {
        super("Line " + line + ": " + message, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
