package com.gridline.app.exceptions;

/**
 * Thrown when an edit would create a circular dependency
 * (e.g., a cell referencing itself, or a multi-cell loop).
 * The edit is rejected before anything is written.
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
