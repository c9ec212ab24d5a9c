package com.gridline.app.services;

import com.gridline.app.config.GridlineProperties;
import com.gridline.app.exceptions.CircularReferenceException;
import com.gridline.app.exceptions.DocumentNotFoundException;
import com.gridline.app.exceptions.InvalidCellReferenceException;
import com.gridline.app.exceptions.SpillCellEditException;
import com.gridline.app.formula.CellInputParser;
import com.gridline.app.formula.ReferencePreprocessor;
import com.gridline.app.formula.ReferenceShifter;
import com.gridline.app.formula.ShiftOperation;
import com.gridline.app.graph.DependencyGraph;
import com.gridline.app.graph.FormulaEdges;
import com.gridline.app.history.CellWrite;
import com.gridline.app.history.DimensionChange;
import com.gridline.app.history.UndoEntry;
import com.gridline.app.history.UndoRedoLog;
import com.gridline.app.models.*;
import com.gridline.app.runtime.ExpressionRuntime;
import com.gridline.app.storage.CellLineFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating documents, setting cell values,
 * undo/redo, structural edits and import/export.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    // All documents live here in memory; the line format is the only persistence
    private final Map<Long, Document> documents = new ConcurrentHashMap<>();

    private final ExpressionRuntime runtime;
    private final int undoDepth;

    private final CellInputParser inputParser = new CellInputParser(new ReferencePreprocessor());
    private final ReferenceShifter shifter = new ReferenceShifter();
    private final CellLineFormat lineFormat = new CellLineFormat(inputParser);

    public DocumentService(ExpressionRuntime runtime, GridlineProperties properties) {
        this.runtime = runtime;
        this.undoDepth = properties.getUndoDepth();
    }

    /**
     * Creates a new, empty document and returns its ID.
     */
    public long createDocument() {
        Document document = new Document(runtime, undoDepth);
        documents.put(document.getId(), document);
        log.info("Created document {}", document.getId());
        return document.getId();
    }

    /**
     * Creates a document from the line format and evaluates all its formulas.
     * Nothing is created when a line is malformed or the formulas form a cycle.
     */
    public long importDocument(String content) {
        SortedMap<CellRef, Cell> cells = lineFormat.parse(content == null ? "" : content);
        Document document = new Document(runtime, undoDepth);
        for (Map.Entry<CellRef, Cell> entry : cells.entrySet()) {
            document.getStore().put(entry.getKey(), entry.getValue());
        }
        try {
            document.getGraph().rebuild(document.getStore());
        } catch (CircularReferenceException ex) {
            log.debug("Rejected import: {}", ex.getMessage());
            throw ex;
        }
        document.getScheduler().recomputeAll();
        documents.put(document.getId(), document);
        log.info("Imported document {} with {} cells", document.getId(), cells.size());
        return document.getId();
    }

    /**
     * Serialises the user content of a document (no spills, no cached results).
     */
    public String exportDocument(long documentId) {
        Document document = getDocument(documentId);
        document.getLock().readLock().lock();
        try {
            return lineFormat.write(document.getStore());
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    /**
     * Retrieves a Document by ID. Throws if not found.
     */
    public Document getDocument(long documentId) {
        Document document = documents.get(documentId);
        if (document == null) {
            throw new DocumentNotFoundException("Document not found: " + documentId);
        }
        return document;
    }

    /**
     * Sets a cell's content with these steps:
     * 1) Refuse cells that belong to another formula's spill.
     * 2) Classify the input; formulas are preprocessed (malformed references throw).
     * 3) Extract the new edges and reject a cycle before anything changes.
     * 4) Write the cell, replace its edges and recompute dependents as one undo entry.
     * If anything fails midway, the entry is rolled back and the graph re-derived.
     */
    public CellView setCellValue(long documentId, String address, String input) {
        Document document = getDocument(documentId);
        CellRef ref = parseAddress(address);

        // Prevent race conditions among multiple writers
        document.getLock().writeLock().lock();
        try {
            CellStore store = document.getStore();
            DependencyGraph graph = document.getGraph();

            // 1) Spilled cells are owned by their formula
            Cell current = store.get(ref);
            if (current.isSpillChild()) {
                log.debug("Rejected edit of {}: spilled from {}", ref, current.getOwner());
                throw new SpillCellEditException("Cell " + ref + " is part of the spill from " + current.getOwner());
            }

            // 2) Literal or formula
            Cell cell = inputParser.parse(input, ref);

            // 3) Cycle check on the candidate edges
            FormulaEdges edges = null;
            if (cell.isFormula()) {
                edges = graph.extractEdges(cell.getPreprocessed());
                if (graph.wouldCycle(ref, edges)) {
                    log.debug("Rejected edit of {}: circular reference", ref);
                    throw new CircularReferenceException("Setting " + ref + " would create a circular reference");
                }
            }

            // 4) Apply
            UndoRedoLog history = document.getHistory();
            history.beginAction("set " + ref);
            try {
                Set<CellRef> changed = new TreeSet<>();
                changed.add(ref);
                if (!cell.isFormula()) {
                    for (CellRef child : store.spillChildrenOf(ref)) {
                        history.write(child, Cell.empty());
                        changed.add(child);
                    }
                }
                history.write(ref, cell);
                if (edges != null) {
                    graph.setEdges(ref, edges);
                } else {
                    graph.removeEdges(ref);
                }
                document.getScheduler().recompute(changed);
                history.commitAction();
            } catch (RuntimeException ex) {
                // If something failed midway, put the store and graph back
                Set<CellRef> restored = new TreeSet<>(history.abortAction());
                restored.add(ref);
                resyncGraph(document, restored);
                throw ex;
            }
            return new CellView(ref, store.get(ref));
        } finally {
            document.getLock().writeLock().unlock();
        }
    }

    public CellView clearCell(long documentId, String address) {
        return setCellValue(documentId, address, "");
    }

    public CellView getCell(long documentId, String address) {
        Document document = getDocument(documentId);
        CellRef ref = parseAddress(address);
        document.getLock().readLock().lock();
        try {
            return new CellView(ref, document.getStore().get(ref));
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a map of address -> evaluated value for all non-empty cells, in (row, column) order.
     * Formulas in error show their marker ("#ERR!", "#SPILL!"); a formula with no value shows null.
     */
    public Map<String, Object> getDocumentData(long documentId) {
        Document document = getDocument(documentId);

        document.getLock().readLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Map.Entry<CellRef, Cell> entry : document.getStore().snapshot().entrySet()) {
                Cell cell = entry.getValue();
                Object value;
                if (cell.getLastError() != null) {
                    value = cell.getLastError().getMarker();
                } else {
                    Value visible = cell.visibleValue();
                    value = visible == null ? null : visible.toPlainObject();
                }
                data.put(entry.getKey().toString(), value);
            }
            return data;
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    /**
     * Reverts the last command and returns its label.
     */
    public String undo(long documentId) {
        Document document = getDocument(documentId);
        document.getLock().writeLock().lock();
        try {
            UndoEntry entry = document.getHistory().undo();
            afterHistoryStep(document, entry);
            return entry.getLabel();
        } finally {
            document.getLock().writeLock().unlock();
        }
    }

    /**
     * Re-applies the last undone command and returns its label.
     */
    public String redo(long documentId) {
        Document document = getDocument(documentId);
        document.getLock().writeLock().lock();
        try {
            UndoEntry entry = document.getHistory().redo();
            afterHistoryStep(document, entry);
            return entry.getLabel();
        } finally {
            document.getLock().writeLock().unlock();
        }
    }

    private void afterHistoryStep(Document document, UndoEntry entry) {
        Set<CellRef> touched = entry.touchedCells();
        resyncGraph(document, touched);
        document.getScheduler().recompute(touched);
        log.debug("Replayed '{}' on document {}, {} cells touched", entry.getLabel(), document.getId(), touched.size());
    }

    // ----------------------------------------------------------------
    // Structural edits
    // ----------------------------------------------------------------

    public void insertRow(long documentId, int index) {
        shift(documentId, ShiftOperation.insert(Dimension.ROW, checkIndex(index)));
    }

    public void deleteRow(long documentId, int index) {
        shift(documentId, ShiftOperation.delete(Dimension.ROW, checkIndex(index)));
    }

    public void insertColumn(long documentId, int index) {
        shift(documentId, ShiftOperation.insert(Dimension.COLUMN, checkIndex(index)));
    }

    public void deleteColumn(long documentId, int index) {
        shift(documentId, ShiftOperation.delete(Dimension.COLUMN, checkIndex(index)));
    }

    /**
     * Moves every cell to its new address, rewrites formula references, and recomputes.
     * Spills are cleared first and derived again by the recompute.
     */
    private void shift(long documentId, ShiftOperation operation) {
        Document document = getDocument(documentId);
        document.getLock().writeLock().lock();
        try {
            CellStore store = document.getStore();
            UndoRedoLog history = document.getHistory();
            history.beginAction(operation.toString());
            try {
                for (CellRef owner : new ArrayList<>(store.getSpillIndex().keySet())) {
                    for (CellRef child : store.spillChildrenOf(owner)) {
                        history.write(child, Cell.empty());
                    }
                }

                SortedMap<CellRef, Cell> before = store.snapshot();
                SortedMap<CellRef, Cell> after = new TreeMap<>();
                for (Map.Entry<CellRef, Cell> entry : before.entrySet()) {
                    CellRef moved = operation.apply(entry.getKey());
                    if (moved != null) {
                        after.put(moved, relocate(entry.getValue(), moved, operation));
                    }
                }

                SortedSet<CellRef> addresses = new TreeSet<>(before.keySet());
                addresses.addAll(after.keySet());
                List<CellWrite> writes = new ArrayList<>();
                for (CellRef ref : addresses) {
                    Cell oldCell = before.getOrDefault(ref, Cell.empty());
                    Cell newCell = after.getOrDefault(ref, Cell.empty());
                    if (!oldCell.equals(newCell)) {
                        writes.add(new CellWrite(ref, oldCell, newCell));
                    }
                }
                history.apply(new DimensionChange(operation.getDimension(), operation.isInsert(),
                        operation.getIndex(), writes));

                document.getGraph().rebuild(store);
                document.getScheduler().recomputeAll();
                history.commitAction();
                log.debug("Applied {} on document {}: {} cells rewritten", operation, documentId, writes.size());
            } catch (RuntimeException ex) {
                history.abortAction();
                document.getGraph().rebuild(store);
                throw ex;
            }
        } finally {
            document.getLock().writeLock().unlock();
        }
    }

    /**
     * A formula keeps working at its new address; one that lost a referenced cell
     * becomes text showing the broken formula.
     */
    private Cell relocate(Cell cell, CellRef at, ShiftOperation operation) {
        if (!cell.isFormula()) {
            return cell;
        }
        String shifted = shifter.shift(cell.getRawFormula(), operation);
        if (ReferenceShifter.hasInvalidReference(shifted)
                && !ReferenceShifter.hasInvalidReference(cell.getRawFormula())) {
            return Cell.text("=" + shifted);
        }
        Cell relocated = inputParser.parse("=" + shifted, at);
        if (relocated.getRawFormula().equals(cell.getRawFormula())
                && relocated.getPreprocessed().equals(cell.getPreprocessed())) {
            return cell;
        }
        return relocated;
    }

    // ----------------------------------------------------------------
    // Dependency views
    // ----------------------------------------------------------------

    public Map<String, List<String>> getForwardGraph(long documentId) {
        Document document = getDocument(documentId);
        document.getLock().readLock().lock();
        try {
            return document.getGraph().getForwardGraph();
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    public Map<String, List<String>> getReverseGraph(long documentId) {
        Document document = getDocument(documentId);
        document.getLock().readLock().lock();
        try {
            return document.getGraph().getReverseGraph();
        } finally {
            document.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private CellRef parseAddress(String address) {
        CellRef ref = CellRef.parse(address);
        if (ref == null) {
            throw new InvalidCellReferenceException("Invalid cell reference: " + address);
        }
        return ref;
    }

    private int checkIndex(int index) {
        if (index < 0) {
            throw new InvalidCellReferenceException("Row/column index must be non-negative: " + index);
        }
        return index;
    }

    /**
     * Makes the graph agree with the store for the given cells.
     */
    private void resyncGraph(Document document, Set<CellRef> cells) {
        for (CellRef ref : cells) {
            Cell cell = document.getStore().get(ref);
            if (cell.isFormula()) {
                document.getGraph().setFormulaEdges(ref, cell.getPreprocessed());
            } else {
                document.getGraph().removeEdges(ref);
            }
        }
    }
}
