package com.gridline.app.exceptions;

/**
 * Thrown by undo with an empty undo stack, or by redo with an empty redo stack.
 */
public class HistoryEmptyException extends RuntimeException {

    private final boolean undo;

    public HistoryEmptyException(boolean undo) {
        super(undo ? "Nothing to undo" : "Nothing to redo");
        this.undo = undo;
    }

    public boolean isUndo() {
        return undo;
    }
}
