package com.gridline.app.models;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sparse storage of cell address -> cell.
 * Absent addresses read as {@link Cell#empty()}; writing an empty cell drops the entry.
 *
 * Also keeps the spill ownership index (owner -> its spill children). The index is
 * derived from every write, so restoring cells from an undo entry restores it too.
 *
 * Not thread-safe on its own: callers hold the owning document's lock.
 */
public class CellStore {

    private final Map<CellRef, Cell> cells = new HashMap<>();
    private final Map<CellRef, SortedSet<CellRef>> spillChildren = new HashMap<>();

    public Cell get(CellRef ref) {
        return cells.getOrDefault(ref, Cell.empty());
    }

    /**
     * Stores a cell and returns the one it replaced (empty if none).
     */
    public Cell put(CellRef ref, Cell cell) {
        Cell previous = cell.isEmpty() ? cells.remove(ref) : cells.put(ref, cell);
        if (previous == null) {
            previous = Cell.empty();
        }
        if (previous.isSpillChild()) {
            SortedSet<CellRef> owned = spillChildren.get(previous.getOwner());
            if (owned != null) {
                owned.remove(ref);
                if (owned.isEmpty()) {
                    spillChildren.remove(previous.getOwner());
                }
            }
        }
        if (cell.isSpillChild()) {
            spillChildren.computeIfAbsent(cell.getOwner(), k -> new TreeSet<>()).add(ref);
        }
        return previous;
    }

    /**
     * The current spill children of a formula, in row order. Empty when it owns none.
     */
    public SortedSet<CellRef> spillChildrenOf(CellRef owner) {
        SortedSet<CellRef> owned = spillChildren.get(owner);
        return owned == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(owned));
    }

    /**
     * Owner of a spill child, or null when the cell is not a spill child.
     */
    public CellRef ownerOf(CellRef ref) {
        Cell cell = get(ref);
        return cell.isSpillChild() ? cell.getOwner() : null;
    }

    public Map<CellRef, SortedSet<CellRef>> getSpillIndex() {
        return Collections.unmodifiableMap(spillChildren);
    }

    public SortedSet<CellRef> getAddresses() {
        return new TreeSet<>(cells.keySet());
    }

    public SortedSet<CellRef> getFormulaAddresses() {
        SortedSet<CellRef> formulas = new TreeSet<>();
        for (Map.Entry<CellRef, Cell> entry : cells.entrySet()) {
            if (entry.getValue().isFormula()) {
                formulas.add(entry.getKey());
            }
        }
        return formulas;
    }

    /**
     * Copy of all non-empty cells ordered by (row, column).
     */
    public SortedMap<CellRef, Cell> snapshot() {
        return new TreeMap<>(cells);
    }

    public int size() {
        return cells.size();
    }

    public void clear() {
        cells.clear();
        spillChildren.clear();
    }
}
