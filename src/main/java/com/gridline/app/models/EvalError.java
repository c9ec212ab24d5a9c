package com.gridline.app.models;

import java.util.Objects;

/**
 * Failure recorded on a formula cell. Not an exception: it is stored in place
 * and observed by readers of the cell.
 */
public final class EvalError {

    private final EvalErrorCode code;
    private final String message;

    public EvalError(EvalErrorCode code, String message) {
        this.code = Objects.requireNonNull(code);
        this.message = message;
    }

    public static EvalError evaluation(String message) {
        return new EvalError(EvalErrorCode.EVALUATION, message);
    }

    public static EvalError spillBlocked(String message) {
        return new EvalError(EvalErrorCode.SPILL_BLOCKED, message);
    }

    public static EvalError upstream(CellRef source) {
        return new EvalError(EvalErrorCode.UPSTREAM, "Referenced cell " + source + " has an error");
    }

    public EvalErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getMarker() {
        return code.getMarker();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvalError)) {
            return false;
        }
        EvalError other = (EvalError) o;
        return code == other.code && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return code.getMarker() + " " + message;
    }
}
