package com.gridline.app.recalc;

import com.gridline.app.exceptions.PoisonedReferenceException;
import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;
import com.gridline.app.models.Value;
import com.gridline.app.runtime.GridView;

/**
 * Grid view over the live store. Formulas see cached results, never re-evaluate.
 */
public class StoreGridView implements GridView {

    private final CellStore store;

    public StoreGridView(CellStore store) {
        this.store = store;
    }

    @Override
    public Value read(CellRef ref) {
        Cell cell = store.get(ref);
        if (cell.isFormula() && cell.getLastError() != null) {
            throw new PoisonedReferenceException(ref);
        }
        return cell.visibleValue();
    }
}
