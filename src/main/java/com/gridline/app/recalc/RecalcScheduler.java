package com.gridline.app.recalc;

import com.gridline.app.exceptions.CircularReferenceException;
import com.gridline.app.graph.DependencyGraph;
import com.gridline.app.graph.FormulaEdges;
import com.gridline.app.history.CellWriter;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRange;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import com.gridline.app.models.EvalError;
import com.gridline.app.models.Value;
import com.gridline.app.runtime.EvaluationResult;
import com.gridline.app.runtime.ExpressionRuntime;
import com.gridline.app.runtime.GridView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Re-evaluates the formulas affected by a change, in dependency order, and keeps
 * array results spilled into the cells below their formula.
 *
 * A formula that fails records its error and the batch continues; formulas reading it
 * then fail with an upstream error. All writes go through the {@link CellWriter}.
 */
public class RecalcScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecalcScheduler.class);

    private final CellStore store;
    private final DependencyGraph graph;
    private final ExpressionRuntime runtime;
    private final CellWriter writer;
    private final GridView view;

    public RecalcScheduler(CellStore store, DependencyGraph graph, ExpressionRuntime runtime, CellWriter writer) {
        this.store = store;
        this.graph = graph;
        this.runtime = runtime;
        this.writer = writer;
        this.view = new StoreGridView(store);
    }

    /**
     * Evaluates the changed formula cells and every transitive dependent of the changed cells.
     *
     * @return the cells in the order they were evaluated
     */
    public List<CellRef> recompute(Collection<CellRef> changed) {
        Set<CellRef> dirty = new HashSet<>();
        for (CellRef ref : changed) {
            if (store.get(ref).isFormula()) {
                dirty.add(ref);
            }
            dirty.addAll(graph.dependentsOf(ref));
        }

        Deque<CellRef> pending = new ArrayDeque<>(orderBatch(dirty));
        List<CellRef> evaluated = new ArrayList<>(pending.size());
        while (!pending.isEmpty()) {
            CellRef ref = pending.poll();
            if (!store.get(ref).isFormula()) {
                continue;
            }
            Set<CellRef> spillChanges = evaluate(ref);
            evaluated.add(ref);
            if (spillChanges.isEmpty()) {
                continue;
            }
            // readers of spilled cells join the batch
            Set<CellRef> remaining = new HashSet<>(pending);
            for (CellRef changedCell : spillChanges) {
                remaining.addAll(graph.dependentsOf(changedCell));
            }
            remaining.remove(ref);
            if (remaining.size() > pending.size()) {
                pending = new ArrayDeque<>(orderBatch(remaining));
            }
        }
        log.debug("Recomputed {} formulas for {} changed cells", evaluated.size(), changed.size());
        return evaluated;
    }

    public List<CellRef> recomputeAll() {
        return recompute(store.getFormulaAddresses());
    }

    // ----------------------------------------------------------------
    // Batch order
    // ----------------------------------------------------------------

    /**
     * Dependency order, where in addition a formula runs before the formulas reading its
     * spill area (the column below it), so that a reader sees a spill produced in the same batch.
     */
    private List<CellRef> orderBatch(Set<CellRef> cells) {
        Map<CellRef, Set<CellRef>> spillReaders = spillReaders(cells);
        if (!spillReaders.isEmpty()) {
            try {
                return graph.order(cells, spillReaders);
            } catch (CircularReferenceException e) {
                log.debug("Spill area readers form a loop among {} formulas, using dependency order", cells.size());
            }
        }
        return graph.order(cells);
    }

    /**
     * Reader -> formulas of the batch whose spill area it reads. A formula that already
     * depends on the reader is left out, since spilling into that reader is refused anyway.
     */
    private Map<CellRef, Set<CellRef>> spillReaders(Set<CellRef> cells) {
        Map<Integer, Set<CellRef>> cellReadersByColumn = new HashMap<>();
        Set<CellRef> rangeReaders = new TreeSet<>();
        for (CellRef reader : cells) {
            FormulaEdges edges = graph.getEdges(reader);
            for (CellRef target : edges.getCells()) {
                cellReadersByColumn.computeIfAbsent(target.getCol(), k -> new TreeSet<>()).add(reader);
            }
            if (!edges.getRanges().isEmpty()) {
                rangeReaders.add(reader);
            }
        }

        Map<CellRef, Set<CellRef>> result = new HashMap<>();
        for (CellRef origin : cells) {
            Set<CellRef> candidates = new TreeSet<>(rangeReaders);
            candidates.addAll(cellReadersByColumn.getOrDefault(origin.getCol(), Collections.emptySet()));
            for (CellRef reader : candidates) {
                if (!reader.equals(origin) && readsSpillArea(reader, origin) && !graph.dependsOn(origin, reader)) {
                    result.computeIfAbsent(reader, k -> new HashSet<>()).add(origin);
                }
            }
        }
        return result;
    }

    private boolean readsSpillArea(CellRef reader, CellRef origin) {
        FormulaEdges edges = graph.getEdges(reader);
        for (CellRef target : edges.getCells()) {
            if (target.getCol() == origin.getCol() && target.getRow() > origin.getRow()) {
                Cell cell = store.get(target);
                if (cell.isEmpty() || cell.isSpillChildOf(origin)) {
                    return true;
                }
            }
        }
        for (CellRange range : edges.getRanges()) {
            if (range.getMinCol() <= origin.getCol() && origin.getCol() <= range.getMaxCol()
                    && range.getMaxRow() > origin.getRow()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates one formula and stores its outcome.
     *
     * @return spill cells whose content changed
     */
    private Set<CellRef> evaluate(CellRef ref) {
        Cell cell = store.get(ref);
        EvaluationResult result = runtime.evaluate(ref, cell.getPreprocessed(), view);
        if (!result.isSuccess()) {
            return fail(ref, cell, result.getError());
        }
        Value value = result.getValue();
        if (value.isArray()) {
            return spill(ref, cell, value.getItems());
        }
        Set<CellRef> cleared = clearSpillFrom(ref, 0);
        writer.write(ref, cell.withResult(value));
        return cleared;
    }

    /**
     * Records the error and keeps the last result. Spill children stay only while
     * that result is the array they were spilled from.
     *
     * @return spill cells that were cleared
     */
    private Set<CellRef> fail(CellRef ref, Cell cell, EvalError error) {
        Value kept = cell.getCachedResult();
        Set<CellRef> cleared = Collections.emptySet();
        if (kept == null || !kept.isArray()) {
            cleared = clearSpillFrom(ref, 0);
        }
        writer.write(ref, cell.withError(error));
        return cleared;
    }

    // ----------------------------------------------------------------
    // Spill
    // ----------------------------------------------------------------

    /**
     * The origin shows item 0; items 1..n-1 go to the rows directly below, same column.
     */
    private Set<CellRef> spill(CellRef origin, Cell cell, List<Value> items) {
        if ((long) origin.getRow() + items.size() - 1 > Integer.MAX_VALUE) {
            return fail(origin, cell, EvalError.spillBlocked("Spill runs past the last row"));
        }
        List<CellRef> targets = new ArrayList<>();
        for (int i = 1; i < items.size(); i++) {
            targets.add(origin.offset(i, 0));
        }
        String blocked = findSpillConflict(origin, targets);
        if (blocked != null) {
            log.debug("Spill of {} blocked: {}", origin, blocked);
            return fail(origin, cell, EvalError.spillBlocked(blocked));
        }

        Set<CellRef> changed = new TreeSet<>();
        for (int i = 1; i < items.size(); i++) {
            CellRef target = targets.get(i - 1);
            Cell child = Cell.spillChild(origin, items.get(i));
            if (!store.get(target).equals(child)) {
                writer.write(target, child);
                changed.add(target);
            }
        }
        changed.addAll(clearSpillFrom(origin, items.size()));
        writer.write(origin, cell.withResult(Value.array(items)));
        return changed;
    }

    private String findSpillConflict(CellRef origin, List<CellRef> targets) {
        for (CellRef target : targets) {
            Cell existing = store.get(target);
            if (!existing.isEmpty() && !existing.isSpillChildOf(origin)) {
                return existing.isSpillChild()
                        ? "Cell " + target + " is already spilled from " + existing.getOwner()
                        : "Cell " + target + " is not empty";
            }
            for (CellRef reader : graph.directDependents(target)) {
                if (reader.equals(origin) || graph.dependsOn(origin, reader)) {
                    return "Spilling into " + target + " would create a circular reference";
                }
            }
        }
        return null;
    }

    /**
     * Clears the origin's spill children at offsets >= length (length 0 clears all).
     */
    private Set<CellRef> clearSpillFrom(CellRef origin, int length) {
        Set<CellRef> cleared = new TreeSet<>();
        for (CellRef child : store.spillChildrenOf(origin)) {
            if (child.getRow() - origin.getRow() >= Math.max(length, 1)) {
                writer.write(child, Cell.empty());
                cleared.add(child);
            }
        }
        return cleared;
    }
}
