package com.gridline.app.formula;

import com.gridline.app.models.CellRef;

import java.util.List;

/**
 * Rewrites the references in a raw formula after a row/column insert or delete.
 * A reference into a deleted row/column, or a range with a deleted corner, becomes {@code #REF!}.
 */
public class ReferenceShifter {

    public static final String INVALID_REFERENCE = "#REF!";

    private final FormulaLexer lexer = new FormulaLexer();

    public String shift(String rawFormula, ShiftOperation operation) {
        List<FormulaToken> tokens = lexer.tokenize(rawFormula);
        StringBuilder out = new StringBuilder(rawFormula.length());
        int i = 0;
        while (i < tokens.size()) {
            FormulaToken token = tokens.get(i);
            CellRef ref = FormulaTokens.isReferenceWord(tokens, i) ? CellRef.parse(token.getText()) : null;
            if (ref == null) {
                out.append(token.getText());
                i++;
                continue;
            }
            CellRef end = null;
            if (i + 2 < tokens.size() && tokens.get(i + 1).is(FormulaTokenType.COLON)
                    && FormulaTokens.isReferenceWord(tokens, i + 2)) {
                end = CellRef.parse(tokens.get(i + 2).getText());
            }
            if (end != null) {
                CellRef shiftedStart = operation.apply(ref);
                CellRef shiftedEnd = operation.apply(end);
                if (shiftedStart == null || shiftedEnd == null) {
                    out.append(INVALID_REFERENCE);
                } else {
                    out.append(shiftedStart).append(':').append(shiftedEnd);
                }
                i += 3;
            } else {
                CellRef shifted = operation.apply(ref);
                out.append(shifted == null ? INVALID_REFERENCE : shifted.toString());
                i++;
            }
        }
        return out.toString();
    }

    public static boolean hasInvalidReference(String rawFormula) {
        return rawFormula.contains(INVALID_REFERENCE);
    }
}
