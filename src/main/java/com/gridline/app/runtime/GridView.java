package com.gridline.app.runtime;

import com.gridline.app.exceptions.PoisonedReferenceException;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only access to cell values during evaluation.
 */
public interface GridView {

    /**
     * The value shown in a cell, or null for an empty cell.
     *
     * @throws PoisonedReferenceException if the cell is a formula whose last evaluation failed
     */
    Value read(CellRef ref);

    /**
     * Numeric view used by plain references: numbers as is, empty as 0, bools as 1/0,
     * anything else NaN.
     */
    default double number(CellRef ref) {
        Value value = read(ref);
        if (value == null) {
            return 0;
        }
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case BOOL:
                return value.getBool() ? 1 : 0;
            default:
                return Double.NaN;
        }
    }

    /**
     * Typed view used by {@code @} references; an empty cell reads as "".
     */
    default Value typed(CellRef ref) {
        Value value = read(ref);
        return value == null ? Value.text("") : value;
    }

    /**
     * Cells between two corners in row-major order, walking each axis in the direction
     * it was written (B3:B1 yields B3, B2, B1). Empty cells are null.
     */
    default List<Value> range(int c1, int r1, int c2, int r2) {
        int rowStep = r1 <= r2 ? 1 : -1;
        int colStep = c1 <= c2 ? 1 : -1;
        List<Value> values = new ArrayList<>();
        for (int row = r1; ; row += rowStep) {
            for (int col = c1; ; col += colStep) {
                values.add(read(CellRef.of(row, col)));
                if (col == c2) {
                    break;
                }
            }
            if (row == r2) {
                break;
            }
        }
        return values;
    }
}
