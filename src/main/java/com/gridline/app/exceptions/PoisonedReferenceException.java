package com.gridline.app.exceptions;

import com.gridline.app.models.CellRef;

/**
 * Raised inside formula evaluation when a formula reads a cell that holds an error.
 * The reading formula then records an upstream error instead of a value.
 */
public class PoisonedReferenceException extends RuntimeException {

    private final CellRef source;

    public PoisonedReferenceException(CellRef source) {
        super("Referenced cell " + source + " has an error");
        this.source = source;
    }

    public CellRef getSource() {
        return source;
    }
}
