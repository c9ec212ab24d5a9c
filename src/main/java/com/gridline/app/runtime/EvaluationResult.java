package com.gridline.app.runtime;

import com.gridline.app.models.EvalError;
import com.gridline.app.models.Value;

/**
 * Outcome of evaluating a formula: either a value or an error, never both.
 */
public final class EvaluationResult {

    private final Value value;
    private final EvalError error;

    private EvaluationResult(Value value, EvalError error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult success(Value value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(EvalError error) {
        return new EvaluationResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Value getValue() {
        return value;
    }

    public EvalError getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success(" + value + ")" : "failure(" + error + ")";
    }
}
