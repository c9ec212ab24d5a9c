package com.gridline.app.models;

/**
 * Axis of a structural edit (row or column insert/delete).
 */
public enum Dimension {
    ROW,
    COLUMN;

    public int coordinate(CellRef ref) {
        return this == ROW ? ref.getRow() : ref.getCol();
    }

    public CellRef withCoordinate(CellRef ref, int value) {
        return this == ROW ? new CellRef(value, ref.getCol()) : new CellRef(ref.getRow(), value);
    }
}
