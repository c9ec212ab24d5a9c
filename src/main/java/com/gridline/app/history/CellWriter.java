package com.gridline.app.history;

import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;

/**
 * Sink for every cell mutation made while executing a command.
 */
public interface CellWriter {

    void write(CellRef ref, Cell cell);
}
