package com.gridline.app.models;

import java.util.Objects;

/**
 * Represents the content of a single spreadsheet cell.
 * Exactly one of the kind-specific fields is meaningful, selected by {@link CellKind}:
 * - NUMBER / TEXT / BOOL: the literal
 * - FORMULA: raw text (without '='), preprocessed text, cached result, last error
 * - SPILL_CHILD: the owning formula's address and the array element shown here
 *
 * Cells are immutable so that undo entries can hold before/after instances safely.
 * Re-evaluation produces a new instance via {@link #withResult} or {@link #withError}.
 */
public final class Cell {

    private static final Cell EMPTY = new Cell(CellKind.EMPTY, 0, null, false, null, null, null, null, null, null);

    private final CellKind kind;
    private final double number;
    private final String text;
    private final boolean bool;
    // formula fields
    private final String rawFormula;
    private final String preprocessed;
    private final Value cachedResult;   // last successful evaluation, may be null
    private final EvalError lastError;  // set when the last evaluation failed
    // spill child fields
    private final CellRef owner;
    private final Value spilledValue;

    private Cell(CellKind kind, double number, String text, boolean bool,
                 String rawFormula, String preprocessed, Value cachedResult, EvalError lastError,
                 CellRef owner, Value spilledValue) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.rawFormula = rawFormula;
        this.preprocessed = preprocessed;
        this.cachedResult = cachedResult;
        this.lastError = lastError;
        this.owner = owner;
        this.spilledValue = spilledValue;
    }

    public static Cell empty() {
        return EMPTY;
    }

    public static Cell number(double number) {
        return new Cell(CellKind.NUMBER, number, null, false, null, null, null, null, null, null);
    }

    public static Cell text(String text) {
        return new Cell(CellKind.TEXT, 0, Objects.requireNonNull(text), false, null, null, null, null, null, null);
    }

    public static Cell bool(boolean bool) {
        return new Cell(CellKind.BOOL, 0, null, bool, null, null, null, null, null, null);
    }

    /**
     * A formula that has not been evaluated yet.
     */
    public static Cell formula(String rawFormula, String preprocessed) {
        return new Cell(CellKind.FORMULA, 0, null, false,
                Objects.requireNonNull(rawFormula), Objects.requireNonNull(preprocessed), null, null, null, null);
    }

    public static Cell spillChild(CellRef owner, Value spilledValue) {
        return new Cell(CellKind.SPILL_CHILD, 0, null, false, null, null, null, null,
                Objects.requireNonNull(owner), Objects.requireNonNull(spilledValue));
    }

    /**
     * Successful evaluation: new cached result, error cleared.
     */
    public Cell withResult(Value result) {
        requireFormula();
        return new Cell(kind, 0, null, false, rawFormula, preprocessed, result, null, null, null);
    }

    /**
     * Failed evaluation: the previous cached result stays next to the error.
     */
    public Cell withError(EvalError error) {
        requireFormula();
        return new Cell(kind, 0, null, false, rawFormula, preprocessed, cachedResult, error, null, null);
    }

    private void requireFormula() {
        if (kind != CellKind.FORMULA) {
            throw new IllegalStateException("Not a formula cell: " + kind);
        }
    }

    public CellKind getKind() {
        return kind;
    }

    public double getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public boolean getBool() {
        return bool;
    }

    public String getRawFormula() {
        return rawFormula;
    }

    public String getPreprocessed() {
        return preprocessed;
    }

    public Value getCachedResult() {
        return cachedResult;
    }

    public EvalError getLastError() {
        return lastError;
    }

    public CellRef getOwner() {
        return owner;
    }

    public Value getSpilledValue() {
        return spilledValue;
    }

    public boolean isEmpty() {
        return kind == CellKind.EMPTY;
    }

    public boolean isFormula() {
        return kind == CellKind.FORMULA;
    }

    public boolean isSpillChild() {
        return kind == CellKind.SPILL_CHILD;
    }

    public boolean isSpillChildOf(CellRef ref) {
        return kind == CellKind.SPILL_CHILD && owner.equals(ref);
    }

    /**
     * The value a reader of this cell sees, or null for an empty cell or a
     * formula that has never been evaluated. An array formula shows its first element.
     */
    public Value visibleValue() {
        switch (kind) {
            case EMPTY:
                return null;
            case NUMBER:
                return Value.number(number);
            case TEXT:
                return Value.text(text);
            case BOOL:
                return Value.bool(bool);
            case FORMULA:
                if (cachedResult != null && cachedResult.isArray()) {
                    return cachedResult.getItems().isEmpty() ? null : cachedResult.getItems().get(0);
                }
                return cachedResult;
            case SPILL_CHILD:
                return spilledValue;
            default:
                throw new IllegalStateException("Unknown cell kind: " + kind);
        }
    }

    /**
     * The text a user would type to recreate this cell, as shown in a formula bar.
     */
    public String toInput() {
        switch (kind) {
            case EMPTY:
            case SPILL_CHILD:
                return "";
            case NUMBER:
                return Value.formatNumber(number);
            case TEXT:
                return text;
            case BOOL:
                return bool ? "TRUE" : "FALSE";
            case FORMULA:
                return "=" + rawFormula;
            default:
                throw new IllegalStateException("Unknown cell kind: " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && bool == other.bool
                && Objects.equals(text, other.text)
                && Objects.equals(rawFormula, other.rawFormula)
                && Objects.equals(preprocessed, other.preprocessed)
                && Objects.equals(cachedResult, other.cachedResult)
                && Objects.equals(lastError, other.lastError)
                && Objects.equals(owner, other.owner)
                && Objects.equals(spilledValue, other.spilledValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, bool, rawFormula, preprocessed, cachedResult, lastError, owner, spilledValue);
    }

    @Override
    public String toString() {
        return kind + "{" + toInput() + (lastError != null ? ", error=" + lastError : "") + "}";
    }
}
