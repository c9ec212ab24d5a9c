package com.gridline.app.history;

import com.gridline.app.exceptions.HistoryEmptyException;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Transactional command log over a cell store.
 *
 * All writes made between {@link #beginAction} and {@link #commitAction} become one undo
 * entry. Writes outside an open action go straight to the store without being recorded
 * (recomputation after undo/redo re-derives values that the entry already restored).
 * The undo stack holds at most maxDepth entries; the oldest is dropped first.
 */
public class UndoRedoLog implements CellWriter {

    private static final Logger log = LoggerFactory.getLogger(UndoRedoLog.class);

    private final CellStore store;
    private final int maxDepth;

    private final Deque<UndoEntry> undoStack = new LinkedList<>();
    private final Deque<UndoEntry> redoStack = new LinkedList<>();

    private String pendingLabel;
    private List<GridOperation> pending;

    public UndoRedoLog(CellStore store, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Undo depth must be at least 1: " + maxDepth);
        }
        this.store = store;
        this.maxDepth = maxDepth;
    }

    public void beginAction(String label) {
        if (pending != null) {
            throw new IllegalStateException("Action '" + pendingLabel + "' is still open");
        }
        pendingLabel = label;
        pending = new ArrayList<>();
    }

    /**
     * Closes the open action and discards the redo stack. An action that changed nothing
     * records no undo entry.
     *
     * @return the recorded entry, or null if nothing changed
     */
    public UndoEntry commitAction() {
        requireOpen();
        List<GridOperation> operations = pending;
        String label = pendingLabel;
        pending = null;
        pendingLabel = null;
        redoStack.clear();
        if (operations.isEmpty()) {
            log.debug("Committed '{}' without changes", label);
            return null;
        }
        UndoEntry entry = new UndoEntry(label, operations);
        undoStack.push(entry);
        while (undoStack.size() > maxDepth) {
            undoStack.removeLast();
        }
        log.debug("Committed {}", entry);
        return entry;
    }

    /**
     * Reverts everything written since {@link #beginAction} and closes the action.
     *
     * @return the cells that were restored
     */
    public Set<CellRef> abortAction() {
        requireOpen();
        Set<CellRef> touched = new TreeSet<>();
        for (int i = pending.size() - 1; i >= 0; i--) {
            GridOperation operation = pending.get(i);
            operation.revert(store);
            touched.addAll(operation.touchedCells());
        }
        log.debug("Aborted '{}', restored {} cells", pendingLabel, touched.size());
        pending = null;
        pendingLabel = null;
        return touched;
    }

    @Override
    public void write(CellRef ref, Cell cell) {
        Cell before = store.get(ref);
        if (before.equals(cell)) {
            return;
        }
        store.put(ref, cell);
        if (pending != null) {
            pending.add(new CellWrite(ref, before, cell));
        }
    }

    public void apply(GridOperation operation) {
        operation.apply(store);
        if (pending != null) {
            pending.add(operation);
        }
    }

    public UndoEntry undo() {
        requireClosed();
        if (undoStack.isEmpty()) {
            throw new HistoryEmptyException(true);
        }
        UndoEntry entry = undoStack.pop();
        entry.revert(store);
        redoStack.push(entry);
        return entry;
    }

    public UndoEntry redo() {
        requireClosed();
        if (redoStack.isEmpty()) {
            throw new HistoryEmptyException(false);
        }
        UndoEntry entry = redoStack.pop();
        entry.apply(store);
        undoStack.push(entry);
        return entry;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int getUndoDepth() {
        return undoStack.size();
    }

    public int getRedoDepth() {
        return redoStack.size();
    }

    public boolean isActionOpen() {
        return pending != null;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    private void requireOpen() {
        if (pending == null) {
            throw new IllegalStateException("No action is open");
        }
    }

    private void requireClosed() {
        if (pending != null) {
            throw new IllegalStateException("Action '" + pendingLabel + "' is still open");
        }
    }
}
