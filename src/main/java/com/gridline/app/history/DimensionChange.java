package com.gridline.app.history;

import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import com.gridline.app.models.Dimension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A row/column insert or delete, recorded as the cell writes that move content into
 * its new layout. For a delete the writes include the content that was removed.
 */
public final class DimensionChange implements GridOperation {

    private final Dimension dimension;
    private final boolean insert;
    private final int index;
    private final List<CellWrite> writes;

    public DimensionChange(Dimension dimension, boolean insert, int index, List<CellWrite> writes) {
        this.dimension = dimension;
        this.insert = insert;
        this.index = index;
        this.writes = Collections.unmodifiableList(new ArrayList<>(writes));
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

    public List<CellWrite> getWrites() {
        return writes;
    }

    /**
     * Cells that stood in the deleted row/column. Empty for an insert.
     */
    public SortedMap<CellRef, Cell> getRemovedContent() {
        SortedMap<CellRef, Cell> removed = new TreeMap<>();
        if (insert) {
            return removed;
        }
        for (CellWrite write : writes) {
            if (dimension.coordinate(write.getRef()) == index && !write.getBefore().isEmpty()) {
                removed.put(write.getRef(), write.getBefore());
            }
        }
        return removed;
    }

    @Override
    public void apply(CellStore store) {
        for (CellWrite write : writes) {
            write.apply(store);
        }
    }

    @Override
    public void revert(CellStore store) {
        for (int i = writes.size() - 1; i >= 0; i--) {
            writes.get(i).revert(store);
        }
    }

    @Override
    public Set<CellRef> touchedCells() {
        Set<CellRef> touched = new TreeSet<>();
        for (CellWrite write : writes) {
            touched.add(write.getRef());
        }
        return touched;
    }

    @Override
    public String toString() {
        return (insert ? "insert " : "delete ") + dimension.name().toLowerCase() + " " + index
                + " (" + writes.size() + " writes)";
    }
}
