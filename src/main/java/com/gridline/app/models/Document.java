package com.gridline.app.models;

import com.gridline.app.graph.DependencyGraph;
import com.gridline.app.history.UndoRedoLog;
import com.gridline.app.recalc.RecalcScheduler;
import com.gridline.app.runtime.ExpressionRuntime;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet document:
 * - Has a unique ID
 * - A sparse store of cells (with spill ownership)
 * - The dependency graph between formulas and what they read
 * - The undo/redo log every edit goes through
 * - The scheduler that recomputes formulas after a change
 * - A read/write lock for concurrency
 */
public class Document {

    // Generates unique IDs for newly created documents
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final CellStore store = new CellStore();
    private final DependencyGraph graph = new DependencyGraph(store);
    private final UndoRedoLog history;
    private final RecalcScheduler scheduler;

    // Single writer per document; readers never see a half-applied edit
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Document(ExpressionRuntime runtime, int undoDepth) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.history = new UndoRedoLog(store, undoDepth);
        this.scheduler = new RecalcScheduler(store, graph, runtime, history);
    }

    public long getId() {
        return id;
    }

    public CellStore getStore() {
        return store;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public UndoRedoLog getHistory() {
        return history;
    }

    public RecalcScheduler getScheduler() {
        return scheduler;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
