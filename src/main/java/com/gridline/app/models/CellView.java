package com.gridline.app.models;

/**
 * JSON view of one cell: what was typed, what it evaluates to, and any error.
 */
public class CellView {

    private final String address;
    private final CellKind kind;
    private final String input;
    private final Object value;
    private final String error;
    private final String errorMessage;
    private final String spillOwner;

    public CellView(CellRef ref, Cell cell) {
        this.address = ref.toString();
        this.kind = cell.getKind();
        this.input = cell.toInput();
        Value visible = cell.visibleValue();
        this.value = visible == null ? null : visible.toPlainObject();
        EvalError lastError = cell.getLastError();
        this.error = lastError == null ? null : lastError.getMarker();
        this.errorMessage = lastError == null ? null : lastError.getMessage();
        this.spillOwner = cell.isSpillChild() ? cell.getOwner().toString() : null;
    }

    public String getAddress() {
        return address;
    }

    public CellKind getKind() {
        return kind;
    }

    public String getInput() {
        return input;
    }

    public Object getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSpillOwner() {
        return spillOwner;
    }
}
