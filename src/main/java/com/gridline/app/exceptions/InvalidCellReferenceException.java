package com.gridline.app.exceptions;

/**
 * Thrown when a caller addresses a cell with text that is not a valid
 * address, for example "A0" or "1A".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
