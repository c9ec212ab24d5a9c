package com.gridline.app.models;

/**
 * The closed set of things a cell can hold.
 */
public enum CellKind {
    EMPTY,
    NUMBER,
    TEXT,
    BOOL,
    FORMULA,
    SPILL_CHILD
}
