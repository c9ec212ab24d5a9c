package com.gridline.app.history;

import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything one top-level command changed, cascade included, in the order it happened.
 */
public final class UndoEntry {

    private final String label;
    private final List<GridOperation> operations;

    public UndoEntry(String label, List<GridOperation> operations) {
        this.label = label;
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public String getLabel() {
        return label;
    }

    public List<GridOperation> getOperations() {
        return operations;
    }

    public void apply(CellStore store) {
        for (GridOperation operation : operations) {
            operation.apply(store);
        }
    }

    public void revert(CellStore store) {
        for (int i = operations.size() - 1; i >= 0; i--) {
            operations.get(i).revert(store);
        }
    }

    public Set<CellRef> touchedCells() {
        Set<CellRef> touched = new TreeSet<>();
        for (GridOperation operation : operations) {
            touched.addAll(operation.touchedCells());
        }
        return touched;
    }

    @Override
    public String toString() {
        return label + " (" + operations.size() + " operations)";
    }
}
