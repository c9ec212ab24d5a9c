package com.gridline.app.controllers;

import com.gridline.app.models.CellView;
import com.gridline.app.services.DocumentService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing spreadsheet Documents.
 * "/document" is the base path.
 */
@RestController
@RequestMapping("/document")
public class DocumentController {

    @Autowired
    private DocumentService documentService;

    /**
     * POST /document
     * Creates a new, empty document and returns its ID.
     */
    @PostMapping
    public ResponseEntity<Long> createDocument() {
        long documentId = documentService.createDocument();
        return ResponseEntity.ok(documentId);
    }

    /**
     * POST /document/import
     * Body: document in the line format ("A1: 42", "B1: =A1 * 2", ...).
     * Creates a new document from it and returns its ID.
     * A malformed line gives 400 INVALID_FILE, cyclic formulas 400 CIRCULAR_REFERENCE.
     */
    @PostMapping("/import")
    public ResponseEntity<Long> importDocument(@RequestBody(required = false) String content) {
        long documentId = documentService.importDocument(content);
        return ResponseEntity.ok(documentId);
    }

    /**
     * GET /document/{documentId}
     * Returns a map of evaluated cell values for the document,
     * in the format: { "A1": 42.0, "B1": "hello", "C1": "#ERR!", ... }.
     */
    @GetMapping("/{documentId}")
    public ResponseEntity<Map<String, Object>> getDocument(@PathVariable long documentId) {
        Map<String, Object> data = documentService.getDocumentData(documentId);
        return ResponseEntity.ok(data);
    }

    /**
     * GET /document/{documentId}/export
     * Returns the document in the line format.
     */
    @GetMapping(value = "/{documentId}/export", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportDocument(@PathVariable long documentId) {
        return ResponseEntity.ok(documentService.exportDocument(documentId));
    }

    @GetMapping("/{documentId}/cell/{address}")
    public ResponseEntity<CellView> getCell(@PathVariable long documentId, @PathVariable String address) {
        return ResponseEntity.ok(documentService.getCell(documentId, address));
    }

    /**
     * PUT /document/{documentId}/cell/{address}
     * Body: the cell input as typed (literal, "=formula", or empty to clear).
     * On success: 200 OK with the updated cell.
     * If the formula is malformed or would create a circular reference, an exception is thrown
     * which the GlobalExceptionHandler turns into a 400.
     */
    @PutMapping("/{documentId}/cell/{address}")
    public ResponseEntity<CellView> setCellValue(
            @PathVariable long documentId,
            @PathVariable String address,
            @RequestBody(required = false) String input
    ) {
        return ResponseEntity.ok(documentService.setCellValue(documentId, address, input));
    }

    @DeleteMapping("/{documentId}/cell/{address}")
    public ResponseEntity<CellView> clearCell(@PathVariable long documentId, @PathVariable String address) {
        return ResponseEntity.ok(documentService.clearCell(documentId, address));
    }

    /**
     * POST /document/{documentId}/undo
     * Reverts the last edit and returns the resulting values.
     * 409 NOTHING_TO_UNDO when there is nothing left.
     */
    @PostMapping("/{documentId}/undo")
    public ResponseEntity<Map<String, Object>> undo(@PathVariable long documentId) {
        documentService.undo(documentId);
        return ResponseEntity.ok(documentService.getDocumentData(documentId));
    }

    /**
     * POST /document/{documentId}/redo
     * Re-applies the last undone edit and returns the resulting values.
     */
    @PostMapping("/{documentId}/redo")
    public ResponseEntity<Map<String, Object>> redo(@PathVariable long documentId) {
        documentService.redo(documentId);
        return ResponseEntity.ok(documentService.getDocumentData(documentId));
    }

    /**
     * POST /document/{documentId}/rows/{index}
     * Inserts an empty row before the zero-based row index.
     */
    @PostMapping("/{documentId}/rows/{index}")
    public ResponseEntity<Void> insertRow(@PathVariable long documentId, @PathVariable int index) {
        documentService.insertRow(documentId, index);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{documentId}/rows/{index}")
    public ResponseEntity<Void> deleteRow(@PathVariable long documentId, @PathVariable int index) {
        documentService.deleteRow(documentId, index);
        return ResponseEntity.ok().build();
    }

    /**
     * POST /document/{documentId}/columns/{index}
     * Inserts an empty column before the zero-based column index (0 = A).
     */
    @PostMapping("/{documentId}/columns/{index}")
    public ResponseEntity<Void> insertColumn(@PathVariable long documentId, @PathVariable int index) {
        documentService.insertColumn(documentId, index);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{documentId}/columns/{index}")
    public ResponseEntity<Void> deleteColumn(@PathVariable long documentId, @PathVariable int index) {
        documentService.deleteColumn(documentId, index);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /document/{documentId}/forwardDependencies
     * Returns the forward dependency graph of the document,
     * i.e., for each formula => the cells and ranges it reads.
     */
    @GetMapping("/{documentId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencyGraph(@PathVariable long documentId) {
        return ResponseEntity.ok(documentService.getForwardGraph(documentId));
    }

    /**
     * GET /document/{documentId}/reverseDependencies
     * Returns the reverse dependency graph of the document,
     * i.e., for each cell or range => the formulas that read it.
     */
    @GetMapping("/{documentId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencyGraph(@PathVariable long documentId) {
        return ResponseEntity.ok(documentService.getReverseGraph(documentId));
    }
}
