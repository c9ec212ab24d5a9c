package com.gridline.app.exceptions;

/**
 * Thrown when formula text has malformed reference or range syntax.
 * Carries the offending span [start, end) within the formula text
 * (without the leading '=').
 */
public class FormulaParseException extends RuntimeException {

    private final int start;
    private final int end;
    private final String fragment;

    public FormulaParseException(String message, String formula, int start, int end) {
        super(message + " at " + start + ".." + end + ": '" + formula.substring(start, end) + "'");
        this.start = start;
        this.end = end;
        this.fragment = formula.substring(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getFragment() {
        return fragment;
    }
}
