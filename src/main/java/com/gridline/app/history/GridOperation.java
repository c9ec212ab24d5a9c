package com.gridline.app.history;

import com.gridline.app.models.CellRef;
import com.gridline.app.models.CellStore;

import java.util.Set;

/**
 * A reversible primitive change to a cell store.
 */
public interface GridOperation {

    void apply(CellStore store);

    void revert(CellStore store);

    /**
     * Addresses whose content differs between the applied and reverted states.
     */
    Set<CellRef> touchedCells();
}
