package com.gridline.app.models;

import java.util.Objects;

/**
 * Opaque chart descriptor returned by the chart range helpers.
 * The engine only stores and compares it; rendering happens elsewhere.
 */
public final class ChartSpec {

    private final String kind;
    private final CellRange range;
    private final String title;

    public ChartSpec(String kind, CellRange range, String title) {
        this.kind = Objects.requireNonNull(kind);
        this.range = Objects.requireNonNull(range);
        this.title = title;
    }

    public String getKind() {
        return kind;
    }

    public CellRange getRange() {
        return range;
    }

    public String getTitle() {
        return title;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChartSpec)) {
            return false;
        }
        ChartSpec other = (ChartSpec) o;
        return kind.equals(other.kind) && range.equals(other.range) && Objects.equals(title, other.title);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, range, title);
    }

    @Override
    public String toString() {
        return "CHART:" + kind + ":" + range + (title == null ? "" : ":" + title);
    }
}
