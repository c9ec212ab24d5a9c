package com.gridline.app.formula;

/**
 * A lexed slice of formula text, [start, end) in the source string.
 */
public final class FormulaToken {

    private final FormulaTokenType type;
    private final String text;
    private final int start;
    private final int end;

    public FormulaToken(FormulaTokenType type, String text, int start, int end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public FormulaTokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean is(FormulaTokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + start;
    }
}
