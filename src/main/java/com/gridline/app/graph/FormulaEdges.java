package com.gridline.app.graph;

import com.gridline.app.models.CellRange;
import com.gridline.app.models.CellRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Precedents read by one formula: single cells plus whole ranges.
 * Ranges stay intervals; they are never expanded into per-cell edges.
 */
public final class FormulaEdges {

    private static final FormulaEdges NONE = new FormulaEdges(new TreeSet<>(), new ArrayList<>());

    private final SortedSet<CellRef> cells;
    private final List<CellRange> ranges;

    public FormulaEdges(SortedSet<CellRef> cells, List<CellRange> ranges) {
        this.cells = Collections.unmodifiableSortedSet(new TreeSet<>(cells));
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    public static FormulaEdges none() {
        return NONE;
    }

    public SortedSet<CellRef> getCells() {
        return cells;
    }

    public List<CellRange> getRanges() {
        return ranges;
    }

    public boolean isEmpty() {
        return cells.isEmpty() && ranges.isEmpty();
    }

    public boolean reads(CellRef ref) {
        if (cells.contains(ref)) {
            return true;
        }
        for (CellRange range : ranges) {
            if (range.contains(ref)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormulaEdges)) {
            return false;
        }
        FormulaEdges other = (FormulaEdges) o;
        return cells.equals(other.cells) && ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells, ranges);
    }

    @Override
    public String toString() {
        return "cells=" + cells + ", ranges=" + ranges;
    }
}
