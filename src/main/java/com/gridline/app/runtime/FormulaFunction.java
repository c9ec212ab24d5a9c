package com.gridline.app.runtime;

/**
 * A native function callable from formulas by name, e.g. {@code CELL(0, 0)}.
 */
@FunctionalInterface
public interface FormulaFunction {

    Object invoke(GridView grid, Object[] args);
}
