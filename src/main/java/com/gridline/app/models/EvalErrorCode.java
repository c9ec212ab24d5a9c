package com.gridline.app.models;

/**
 * Kinds of per-cell formula failure, with the marker shown in place of a value.
 */
public enum EvalErrorCode {
    EVALUATION("#ERR!"),
    SPILL_BLOCKED("#SPILL!"),
    UPSTREAM("#ERR!");

    private final String marker;

    EvalErrorCode(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }
}
