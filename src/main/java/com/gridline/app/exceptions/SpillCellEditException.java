package com.gridline.app.exceptions;

/**
 * Thrown when a user edits a cell that currently holds part of another
 * formula's spilled array. Such cells change only through their owner.
 */
public class SpillCellEditException extends RuntimeException {
    public SpillCellEditException(String message) {
        super(message);
    }
}
