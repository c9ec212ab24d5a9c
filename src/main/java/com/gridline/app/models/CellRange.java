package com.gridline.app.models;

import java.util.Objects;

/**
 * Rectangular block of cells, stored with normalised bounds.
 * Used for range dependency edges; iteration direction is not kept here.
 */
public final class CellRange {

    private final int minRow;
    private final int minCol;
    private final int maxRow;
    private final int maxCol;

    private CellRange(int minRow, int minCol, int maxRow, int maxCol) {
        this.minRow = minRow;
        this.minCol = minCol;
        this.maxRow = maxRow;
        this.maxCol = maxCol;
    }

    /**
     * Builds a range from two corners given in any order.
     */
    public static CellRange of(CellRef a, CellRef b) {
        return new CellRange(
                Math.min(a.getRow(), b.getRow()),
                Math.min(a.getCol(), b.getCol()),
                Math.max(a.getRow(), b.getRow()),
                Math.max(a.getCol(), b.getCol()));
    }

    public int getMinRow() {
        return minRow;
    }

    public int getMinCol() {
        return minCol;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMaxCol() {
        return maxCol;
    }

    public CellRef getTopLeft() {
        return new CellRef(minRow, minCol);
    }

    public CellRef getBottomRight() {
        return new CellRef(maxRow, maxCol);
    }

    public boolean contains(CellRef ref) {
        return ref.getRow() >= minRow && ref.getRow() <= maxRow
                && ref.getCol() >= minCol && ref.getCol() <= maxCol;
    }

    public long size() {
        return (long) (maxRow - minRow + 1) * (maxCol - minCol + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return minRow == other.minRow && minCol == other.minCol
                && maxRow == other.maxRow && maxCol == other.maxCol;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minRow, minCol, maxRow, maxCol);
    }

    @Override
    public String toString() {
        return getTopLeft() + ":" + getBottomRight();
    }
}
