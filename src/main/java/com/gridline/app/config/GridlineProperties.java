package com.gridline.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings, bound from {@code gridline.*} in application.properties.
 */
@ConfigurationProperties(prefix = "gridline")
public class GridlineProperties {

    // Undo entries kept per document
    private int undoDepth = 100;

    // Largest range a single range helper may read
    private long maxRangeCells = 1_000_000;

    // Parsed formulas kept by the expression runtime
    private int expressionCacheSize = 512;

    public int getUndoDepth() {
        return undoDepth;
    }

    public void setUndoDepth(int undoDepth) {
        this.undoDepth = undoDepth;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public int getExpressionCacheSize() {
        return expressionCacheSize;
    }

    public void setExpressionCacheSize(int expressionCacheSize) {
        this.expressionCacheSize = expressionCacheSize;
    }
}
