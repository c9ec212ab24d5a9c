package com.gridline.app.history;

import com.gridline.app.exceptions.HistoryEmptyException;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import com.gridline.app.models.Dimension;
import com.gridline.app.models.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class UndoRedoLogTest {

    private static final CellRef A1 = CellRef.parse("A1");
    private static final CellRef A2 = CellRef.parse("A2");
    private static final CellRef B1 = CellRef.parse("B1");

    private CellStore store;
    private UndoRedoLog log;

    @BeforeEach
    void setUp() {
        store = new CellStore();
        log = new UndoRedoLog(store, 3);
    }

    private void action(String label, CellRef ref, Cell cell) {
        log.beginAction(label);
        log.write(ref, cell);
        log.commitAction();
    }

    @Test
    void testWritesOutsideActionAreNotRecorded() {
        log.write(A1, Cell.number(1));
        assertEquals(Cell.number(1), store.get(A1));
        assertFalse(log.canUndo());
    }

    @Test
    void testUndoAndRedoWholeAction() {
        log.beginAction("two cells");
        log.write(A1, Cell.number(1));
        log.write(B1, Cell.text("x"));
        UndoEntry entry = log.commitAction();
        assertNotNull(entry);
        assertEquals("two cells", entry.getLabel());

        log.undo();
        assertTrue(store.get(A1).isEmpty());
        assertTrue(store.get(B1).isEmpty());
        assertTrue(log.canRedo());

        log.redo();
        assertEquals(Cell.number(1), store.get(A1));
        assertEquals(Cell.text("x"), store.get(B1));
        assertFalse(log.canRedo());
    }

    /**
     * A new command after an undo discards the redo stack.
     */
    @Test
    void testCommitClearsRedo() {
        action("first", A1, Cell.number(1));
        log.undo();
        assertTrue(log.canRedo());

        action("second", A1, Cell.number(2));
        assertFalse(log.canRedo());
        assertThrows(HistoryEmptyException.class, () -> log.redo());
    }

    /**
     * An action that changes nothing records no entry but still counts as a new command.
     */
    @Test
    void testEmptyActionIsNotRecorded() {
        action("first", A1, Cell.number(1));
        log.undo();
        assertEquals(1, log.getRedoDepth());

        log.beginAction("no-op");
        log.write(A2, Cell.empty());
        assertNull(log.commitAction());
        assertEquals(0, log.getUndoDepth());
        assertEquals(0, log.getRedoDepth());
        assertFalse(log.canRedo());
    }

    @Test
    void testRewritingSameCellIsSkipped() {
        store.put(A1, Cell.number(1));
        log.beginAction("same");
        log.write(A1, Cell.number(1));
        assertNull(log.commitAction());
    }

    @Test
    void testAbortRestoresStore() {
        store.put(A1, Cell.number(1));
        log.beginAction("broken");
        log.write(A1, Cell.number(2));
        log.write(B1, Cell.number(3));
        log.write(A1, Cell.number(4));

        Set<CellRef> restored = log.abortAction();

        assertEquals(new TreeSet<>(Arrays.asList(A1, B1)), restored);
        assertEquals(Cell.number(1), store.get(A1));
        assertTrue(store.get(B1).isEmpty());
        assertFalse(log.canUndo());
        assertFalse(log.isActionOpen());
    }

    /**
     * Only the newest entries are kept once the depth is reached.
     */
    @Test
    void testDepthBound() {
        for (int i = 1; i <= 5; i++) {
            action("set " + i, A1, Cell.number(i));
        }
        assertEquals(3, log.getUndoDepth());
        log.undo();
        log.undo();
        log.undo();
        assertEquals(Cell.number(2), store.get(A1));
        HistoryEmptyException ex = assertThrows(HistoryEmptyException.class, () -> log.undo());
        assertTrue(ex.isUndo());
    }

    @Test
    void testEmptyHistory() {
        assertTrue(assertThrows(HistoryEmptyException.class, () -> log.undo()).isUndo());
        assertFalse(assertThrows(HistoryEmptyException.class, () -> log.redo()).isUndo());
    }

    @Test
    void testNestedActionsRejected() {
        log.beginAction("outer");
        assertThrows(IllegalStateException.class, () -> log.beginAction("inner"));
        assertThrows(IllegalStateException.class, () -> log.undo());
    }

    @Test
    void testSpillIndexFollowsUndo() {
        action("spill", A2, Cell.spillChild(A1, Value.number(2)));
        assertEquals(1, store.spillChildrenOf(A1).size());

        log.undo();
        assertTrue(store.spillChildrenOf(A1).isEmpty());

        log.redo();
        assertTrue(store.spillChildrenOf(A1).contains(A2));
    }

    @Test
    void testDimensionChange() {
        store.put(A1, Cell.number(1));
        store.put(A2, Cell.number(2));

        // delete row 1 (zero-based 0): A2 moves up, A1's content is removed
        DimensionChange change = new DimensionChange(Dimension.ROW, false, 0, Arrays.asList(
                new CellWrite(A1, Cell.number(1), Cell.number(2)),
                new CellWrite(A2, Cell.number(2), Cell.empty())));
        log.beginAction(change.toString());
        log.apply(change);
        log.commitAction();

        assertEquals(Cell.number(2), store.get(A1));
        assertTrue(store.get(A2).isEmpty());
        assertEquals(Cell.number(1), change.getRemovedContent().get(A1));

        log.undo();
        assertEquals(Cell.number(1), store.get(A1));
        assertEquals(Cell.number(2), store.get(A2));
    }
}
