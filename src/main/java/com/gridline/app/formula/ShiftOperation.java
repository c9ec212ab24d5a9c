package com.gridline.app.formula;

import com.gridline.app.models.CellRef;
import com.gridline.app.models.Dimension;

/**
 * A row or column insert/delete at a zero-based index, as seen by cell addresses.
 */
public final class ShiftOperation {

    private final Dimension dimension;
    private final boolean insert;
    private final int index;

    public ShiftOperation(Dimension dimension, boolean insert, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
        this.dimension = dimension;
        this.insert = insert;
        this.index = index;
    }

    public static ShiftOperation insert(Dimension dimension, int index) {
        return new ShiftOperation(dimension, true, index);
    }

    public static ShiftOperation delete(Dimension dimension, int index) {
        return new ShiftOperation(dimension, false, index);
    }

    public Dimension getDimension() {
        return dimension;
    }

    public boolean isInsert() {
        return insert;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Where the cell at ref ends up, or null if its row/column is deleted.
     */
    public CellRef apply(CellRef ref) {
        int coordinate = dimension.coordinate(ref);
        if (insert) {
            return coordinate >= index ? dimension.withCoordinate(ref, coordinate + 1) : ref;
        }
        if (coordinate == index) {
            return null;
        }
        return coordinate > index ? dimension.withCoordinate(ref, coordinate - 1) : ref;
    }

    @Override
    public String toString() {
        return (insert ? "insert " : "delete ") + dimension.name().toLowerCase() + " " + index;
    }
}
