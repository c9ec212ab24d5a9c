package com.gridline.app.history;

import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;

import java.util.Collections;
import java.util.Set;

/**
 * Replacement of one cell's content.
 */
public final class CellWrite implements GridOperation {

    private final CellRef ref;
    private final Cell before;
    private final Cell after;

    public CellWrite(CellRef ref, Cell before, Cell after) {
        this.ref = ref;
        this.before = before;
        this.after = after;
    }

    public CellRef getRef() {
        return ref;
    }

    public Cell getBefore() {
        return before;
    }

    public Cell getAfter() {
        return after;
    }

    @Override
    public void apply(CellStore store) {
        store.put(ref, after);
    }

    @Override
    public void revert(CellStore store) {
        store.put(ref, before);
    }

    @Override
    public Set<CellRef> touchedCells() {
        return Collections.singleton(ref);
    }

    @Override
    public String toString() {
        return ref + ": " + before + " -> " + after;
    }
}
