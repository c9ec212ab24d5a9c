package com.gridline.app.services;

import com.gridline.app.config.GridlineProperties;
import com.gridline.app.exceptions.CircularReferenceException;
import com.gridline.app.exceptions.DocumentNotFoundException;
import com.gridline.app.exceptions.FormulaParseException;
import com.gridline.app.exceptions.GridFileFormatException;
import com.gridline.app.exceptions.HistoryEmptyException;
import com.gridline.app.exceptions.InvalidCellReferenceException;
import com.gridline.app.exceptions.SpillCellEditException;
import com.gridline.app.graph.FormulaEdges;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellKind;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellView;
import com.gridline.app.models.Document;
import com.gridline.app.runtime.SpelExpressionRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class DocumentServiceTest {

    private DocumentService documentService;
    private long documentId;

    @BeforeEach
    void setUp() {
        documentService = new DocumentService(SpelExpressionRuntime.withBuiltins(64, 100_000), new GridlineProperties());
        documentId = documentService.createDocument();
    }

    private Object value(String address) {
        return documentService.getDocumentData(documentId).get(address);
    }

    private SortedMap<CellRef, Cell> storeSnapshot() {
        return documentService.getDocument(documentId).getStore().snapshot();
    }

    private SortedMap<CellRef, FormulaEdges> graphSnapshot() {
        return documentService.getDocument(documentId).getGraph().snapshot();
    }

    /**
     * Literals are classified and shown as typed values.
     */
    @Test
    void testSetLiterals() {
        documentService.setCellValue(documentId, "A1", "10");
        documentService.setCellValue(documentId, "B1", "hello");
        documentService.setCellValue(documentId, "C1", "true");
        documentService.setCellValue(documentId, "D1", "\"42\"");

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals(10.0, data.get("A1"));
        assertEquals("hello", data.get("B1"));
        assertEquals(true, data.get("C1"));
        assertEquals("42", data.get("D1"));
    }

    /**
     * A1=10, A2=20, A3=SUM(A1:A2) gives 30; changing A1 to 15 gives 35.
     */
    @Test
    void testFormulaRecalculation() {
        documentService.setCellValue(documentId, "A1", "10");
        documentService.setCellValue(documentId, "A2", "20");
        CellView view = documentService.setCellValue(documentId, "A3", "=SUM(A1:A2)");
        assertEquals(30.0, view.getValue());

        documentService.setCellValue(documentId, "A1", "15");
        assertEquals(35.0, value("A3"));
    }

    @Test
    void testTypedReference() {
        documentService.setCellValue(documentId, "B1", "hello");
        documentService.setCellValue(documentId, "C1", "=@B1 + ' world'");
        assertEquals("hello world", value("C1"));
    }

    /**
     * Tests that a self-referencing formula is rejected and the cell keeps its value.
     */
    @Test
    void testSelfReferenceRejected() {
        documentService.setCellValue(documentId, "A1", "5");
        assertThrows(CircularReferenceException.class,
                () -> documentService.setCellValue(documentId, "A1", "=A1 + 1"));
        assertEquals(5.0, value("A1"));
        assertTrue(graphSnapshot().isEmpty());
    }

    /**
     * A -> B -> A and longer loops are rejected without touching store, graph or history.
     */
    @Test
    void testMutualReferenceRejected() {
        documentService.setCellValue(documentId, "A1", "=B1");
        documentService.setCellValue(documentId, "C1", "=A1 * 2");
        SortedMap<CellRef, Cell> storeBefore = storeSnapshot();
        SortedMap<CellRef, FormulaEdges> graphBefore = graphSnapshot();
        int undoDepth = documentService.getDocument(documentId).getHistory().getUndoDepth();

        assertThrows(CircularReferenceException.class,
                () -> documentService.setCellValue(documentId, "B1", "=A1"));
        assertThrows(CircularReferenceException.class,
                () -> documentService.setCellValue(documentId, "B1", "=C1 + 1"));
        assertThrows(CircularReferenceException.class,
                () -> documentService.setCellValue(documentId, "B1", "=SUM(C1:C3)"));

        assertEquals(storeBefore, storeSnapshot());
        assertEquals(graphBefore, graphSnapshot());
        assertEquals(undoDepth, documentService.getDocument(documentId).getHistory().getUndoDepth());
    }

    @Test
    void testMalformedFormulaRejected() {
        documentService.setCellValue(documentId, "A1", "1");
        SortedMap<CellRef, Cell> before = storeSnapshot();

        assertThrows(FormulaParseException.class,
                () -> documentService.setCellValue(documentId, "B1", "=SUM(A1)"));
        assertThrows(FormulaParseException.class,
                () -> documentService.setCellValue(documentId, "B1", "=A0 + 1"));
        assertEquals(before, storeSnapshot());
    }

    /**
     * A formula that fails at runtime stores an error; readers fail with an upstream error.
     */
    @Test
    void testEvaluationErrors() {
        documentService.setCellValue(documentId, "A1", "=1 +");
        documentService.setCellValue(documentId, "B1", "=A1 * 2");

        assertEquals("#ERR!", value("A1"));
        assertEquals("#ERR!", value("B1"));
        CellView reader = documentService.getCell(documentId, "B1");
        assertEquals("#ERR!", reader.getError());
        assertTrue(reader.getErrorMessage().contains("A1"));

        documentService.setCellValue(documentId, "A1", "=2");
        assertEquals(4.0, value("B1"));
    }

    @Test
    void testVecSpillsInWrittenDirection() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "B3", "3");

        documentService.setCellValue(documentId, "A1", "=VEC(B3:B1)");
        documentService.setCellValue(documentId, "C1", "=VEC(B1:B3)");

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals(3.0, data.get("A1"));
        assertEquals(2.0, data.get("A2"));
        assertEquals(1.0, data.get("A3"));
        assertEquals(1.0, data.get("C1"));
        assertEquals(2.0, data.get("C2"));
        assertEquals(3.0, data.get("C3"));
        assertEquals("A1", documentService.getCell(documentId, "A3").getSpillOwner());
    }

    /**
     * Shrinking an array from 3 to 1 element clears the two cells it no longer covers.
     */
    @Test
    void testShrinkingSpill() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "B3", "3");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B3)");
        assertEquals(3.0, value("A3"));

        documentService.setCellValue(documentId, "A1", "=VEC(B1:B1)");

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals(1.0, data.get("A1"));
        assertFalse(data.containsKey("A2"));
        assertFalse(data.containsKey("A3"));
    }

    @Test
    void testSpilledCellsFeedOtherFormulas() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "B3", "3");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B3)");
        documentService.setCellValue(documentId, "C2", "=A2 * 10");
        assertEquals(20.0, value("C2"));

        documentService.setCellValue(documentId, "B2", "7");
        assertEquals(70.0, value("C2"));
    }

    @Test
    void testBlockedSpill() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "B3", "3");
        documentService.setCellValue(documentId, "A3", "x");

        documentService.setCellValue(documentId, "A1", "=VEC(B1:B3)");

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals("#SPILL!", data.get("A1"));
        assertFalse(data.containsKey("A2"));
        assertEquals("x", data.get("A3"));

        // freeing the blocker lets the next recalculation spill
        documentService.setCellValue(documentId, "A3", "");
        documentService.setCellValue(documentId, "B1", "10");
        assertEquals(3.0, value("A3"));
    }

    @Test
    void testSpilledCellCannotBeEdited() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B2)");

        assertThrows(SpillCellEditException.class, () -> documentService.setCellValue(documentId, "A2", "5"));
        assertEquals(2.0, value("A2"));
    }

    @Test
    void testClearingOriginRemovesSpill() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B2)");

        documentService.clearCell(documentId, "A1");

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals(Arrays.asList("B1", "B2"), List.copyOf(data.keySet()));
    }

    /**
     * Replacing an array formula with one that fails leaves no cells from the old spill.
     */
    @Test
    void testFailingFormulaReplacesSpill() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "B3", "3");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B3)");
        assertEquals(CellKind.SPILL_CHILD, documentService.getCell(documentId, "A3").getKind());

        CellView view = documentService.setCellValue(documentId, "A1", "=1 +");

        assertEquals("#ERR!", view.getError());
        assertTrue(documentService.getDocument(documentId).getStore().spillChildrenOf(CellRef.parse("A1")).isEmpty());
        assertEquals(CellKind.EMPTY, documentService.getCell(documentId, "A2").getKind());
        assertEquals(CellKind.EMPTY, documentService.getCell(documentId, "A3").getKind());

        documentService.undo(documentId);
        assertEquals(2.0, value("A2"));
        assertEquals(3.0, value("A3"));
    }

    /**
     * Undo restores the store and graph exactly; redo restores the state after the edit.
     */
    @Test
    void testUndoRedoRestoresSnapshots() {
        documentService.setCellValue(documentId, "A1", "1");
        SortedMap<CellRef, Cell> storeBefore = storeSnapshot();
        SortedMap<CellRef, FormulaEdges> graphBefore = graphSnapshot();

        documentService.setCellValue(documentId, "A2", "=A1 + 1");
        SortedMap<CellRef, Cell> storeAfter = storeSnapshot();
        SortedMap<CellRef, FormulaEdges> graphAfter = graphSnapshot();

        assertEquals("set A2", documentService.undo(documentId));
        assertEquals(storeBefore, storeSnapshot());
        assertEquals(graphBefore, graphSnapshot());

        assertEquals("set A2", documentService.redo(documentId));
        assertEquals(storeAfter, storeSnapshot());
        assertEquals(graphAfter, graphSnapshot());
    }

    @Test
    void testUndoRestoresRecalculatedDependents() {
        documentService.setCellValue(documentId, "A1", "10");
        documentService.setCellValue(documentId, "B1", "=A1 * 2");
        documentService.setCellValue(documentId, "A1", "50");
        assertEquals(100.0, value("B1"));

        documentService.undo(documentId);
        assertEquals(10.0, value("A1"));
        assertEquals(20.0, value("B1"));
    }

    @Test
    void testUndoRemovesSpill() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B2)");

        documentService.undo(documentId);

        assertFalse(documentService.getDocumentData(documentId).containsKey("A2"));
        assertTrue(documentService.getDocument(documentId).getStore().getSpillIndex().isEmpty());
    }

    /**
     * A new edit after undo discards the redo history.
     */
    @Test
    void testNewEditClearsRedo() {
        documentService.setCellValue(documentId, "A1", "1");
        documentService.setCellValue(documentId, "A1", "2");
        documentService.undo(documentId);

        documentService.setCellValue(documentId, "B1", "3");

        assertThrows(HistoryEmptyException.class, () -> documentService.redo(documentId));
        assertEquals(1.0, value("A1"));
    }

    /**
     * Re-entering the value a cell already holds still counts as a new edit after an undo.
     */
    @Test
    void testUnchangedEditClearsRedo() {
        documentService.setCellValue(documentId, "A1", "1");
        documentService.setCellValue(documentId, "A1", "2");
        documentService.undo(documentId);
        assertTrue(documentService.getDocument(documentId).getHistory().canRedo());

        documentService.setCellValue(documentId, "A1", "1");

        assertFalse(documentService.getDocument(documentId).getHistory().canRedo());
        assertThrows(HistoryEmptyException.class, () -> documentService.redo(documentId));
        assertEquals(1.0, value("A1"));
    }

    @Test
    void testUndoWithEmptyHistory() {
        HistoryEmptyException ex = assertThrows(HistoryEmptyException.class, () -> documentService.undo(documentId));
        assertTrue(ex.isUndo());
    }

    @Test
    void testUndoDepthFromProperties() {
        GridlineProperties properties = new GridlineProperties();
        properties.setUndoDepth(2);
        DocumentService limited = new DocumentService(SpelExpressionRuntime.withBuiltins(16, 1000), properties);
        long id = limited.createDocument();
        limited.setCellValue(id, "A1", "1");
        limited.setCellValue(id, "A1", "2");
        limited.setCellValue(id, "A1", "3");

        limited.undo(id);
        limited.undo(id);
        assertThrows(HistoryEmptyException.class, () -> limited.undo(id));
        assertEquals(1.0, limited.getDocumentData(id).get("A1"));
    }

    /**
     * Inserting a row moves content down and rewrites references; undo puts it back.
     */
    @Test
    void testInsertRow() {
        documentService.setCellValue(documentId, "A1", "1");
        documentService.setCellValue(documentId, "A2", "2");
        documentService.setCellValue(documentId, "A3", "=A1 + A2");

        documentService.insertRow(documentId, 0);

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertFalse(data.containsKey("A1"));
        assertEquals(1.0, data.get("A2"));
        assertEquals(2.0, data.get("A3"));
        assertEquals(3.0, data.get("A4"));
        assertEquals("=A2 + A3", documentService.getCell(documentId, "A4").getInput());

        documentService.setCellValue(documentId, "A2", "5");
        assertEquals(7.0, value("A4"));

        documentService.undo(documentId);
        documentService.undo(documentId);
        assertEquals("=A1 + A2", documentService.getCell(documentId, "A3").getInput());
        assertEquals(3.0, value("A3"));
    }

    @Test
    void testInsertRowGrowsRange() {
        documentService.setCellValue(documentId, "A1", "1");
        documentService.setCellValue(documentId, "A2", "2");
        documentService.setCellValue(documentId, "A3", "3");
        documentService.setCellValue(documentId, "B1", "=SUM(A1:A3)");

        documentService.insertRow(documentId, 1);

        assertEquals("=SUM(A1:A4)", documentService.getCell(documentId, "B1").getInput());
        assertEquals(6.0, value("B1"));
    }

    /**
     * Deleting a referenced row turns the formula into text showing #REF!.
     */
    @Test
    void testDeleteReferencedRow() {
        documentService.setCellValue(documentId, "A1", "1");
        documentService.setCellValue(documentId, "A2", "2");
        documentService.setCellValue(documentId, "B1", "=A1 + A2");

        documentService.deleteRow(documentId, 1);

        CellView cell = documentService.getCell(documentId, "B1");
        assertEquals(CellKind.TEXT, cell.getKind());
        assertEquals("=A1 + #REF!", cell.getValue());
        assertFalse(documentService.getDocumentData(documentId).containsKey("A2"));
        assertTrue(graphSnapshot().isEmpty());
    }

    @Test
    void testDeleteColumn() {
        documentService.setCellValue(documentId, "A1", "1");
        documentService.setCellValue(documentId, "B1", "2");
        documentService.setCellValue(documentId, "C1", "=B1 * 10");

        documentService.deleteColumn(documentId, 0);

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals(2.0, data.get("A1"));
        assertEquals(20.0, data.get("B1"));
        assertEquals("=A1 * 10", documentService.getCell(documentId, "B1").getInput());
    }

    @Test
    void testInsertColumnMovesSpill() {
        documentService.setCellValue(documentId, "B1", "1");
        documentService.setCellValue(documentId, "B2", "2");
        documentService.setCellValue(documentId, "A1", "=VEC(B1:B2)");

        documentService.insertColumn(documentId, 0);

        Map<String, Object> data = documentService.getDocumentData(documentId);
        assertEquals(1.0, data.get("B1"));
        assertEquals(2.0, data.get("B2"));
        assertEquals(1.0, data.get("C1"));
        assertEquals("=VEC(C1:C2)", documentService.getCell(documentId, "B1").getInput());
        assertFalse(data.containsKey("A2"));
    }

    @Test
    void testImportExportRoundTrip() {
        String content = "# saved by hand\n"
                + "A1: 10\n"
                + "A2: 20\n"
                + "A3: =SUM(A1:A2)\n"
                + "B1: \"hi\"\n";
        long imported = documentService.importDocument(content);
        assertEquals(30.0, documentService.getDocumentData(imported).get("A3"));

        String exported = documentService.exportDocument(imported);
        assertEquals("# Gridline Spreadsheet\n"
                + "A1: 10\n"
                + "B1: \"hi\"\n"
                + "A2: 20\n"
                + "A3: =SUM(A1:A2)\n", exported);

        long reimported = documentService.importDocument(exported);
        assertEquals(documentService.getDocument(imported).getStore().snapshot(),
                documentService.getDocument(reimported).getStore().snapshot());
    }

    @Test
    void testImportRejectsCycle() {
        assertThrows(CircularReferenceException.class,
                () -> documentService.importDocument("A1: =B1\nB1: =A1\n"));
    }

    @Test
    void testImportRejectsMalformedLine() {
        assertThrows(GridFileFormatException.class, () -> documentService.importDocument("A1 10\n"));
    }

    @Test
    void testUnknownDocumentAndBadAddress() {
        assertThrows(DocumentNotFoundException.class, () -> documentService.getDocumentData(documentId + 1000));
        assertThrows(InvalidCellReferenceException.class,
                () -> documentService.setCellValue(documentId, "1A", "5"));
        assertThrows(InvalidCellReferenceException.class, () -> documentService.insertRow(documentId, -1));
    }

    @Test
    void testDependencyGraphViews() {
        documentService.setCellValue(documentId, "A3", "=SUM(A1:A2) + B1");

        Map<String, List<String>> forward = documentService.getForwardGraph(documentId);
        assertEquals(Collections.singletonMap("A3", Arrays.asList("B1", "A1:A2")), forward);

        Map<String, List<String>> reverse = new LinkedHashMap<>();
        reverse.put("A1:A2", Collections.singletonList("A3"));
        reverse.put("B1", Collections.singletonList("A3"));
        assertEquals(reverse, documentService.getReverseGraph(documentId));
    }

    /**
     * Tests concurrency by creating multiple threads that set different cells.
     * Ensures no race condition or exception is thrown and every dependent ends up consistent.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        documentService.setCellValue(documentId, "C1", "=SUM(A1:B50)");

        Runnable task1 = () -> {
            for (int i = 1; i <= 50; i++) {
                documentService.setCellValue(documentId, "A" + i, String.valueOf(i));
            }
        };
        Runnable task2 = () -> {
            for (int i = 1; i <= 50; i++) {
                documentService.setCellValue(documentId, "B" + i, "1");
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);
        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Document document = documentService.getDocument(documentId);
        assertEquals(101, document.getStore().size());
        // 1 + 2 + ... + 50 plus fifty ones
        assertEquals(1325.0, value("C1"));
    }
}
