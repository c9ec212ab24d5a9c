package com.gridline.app.runtime;

import com.gridline.app.models.CellRef;

/**
 * The engine's only view of the formula language: evaluate preprocessed text against a
 * read-only grid, and register native functions the preprocessed text may call.
 */
public interface ExpressionRuntime {

    /**
     * Evaluates one formula. Never throws for a bad formula: failures come back
     * as {@link EvaluationResult#failure}.
     */
    EvaluationResult evaluate(CellRef cell, String preprocessed, GridView grid);

    void registerFunction(String name, FormulaFunction function);
}
