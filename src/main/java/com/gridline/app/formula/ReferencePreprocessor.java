package com.gridline.app.formula;

import com.gridline.app.exceptions.FormulaParseException;
import com.gridline.app.models.CellRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites cell and range references in formula text into accessor calls
 * the expression runtime understands:
 * <ul>
 *   <li>{@code A1} becomes {@code CELL(0, 0)} (numeric view of the cell)</li>
 *   <li>{@code @A1} becomes {@code VALUE(0, 0)} (typed view of the cell)</li>
 *   <li>{@code SUM(A1:B5)} becomes {@code SUM_RANGE(0, 0, 1, 4)}, corners kept in written order</li>
 *   <li>{@code ROW()} / {@code COL()} become the one-based row/column of the cell being edited</li>
 * </ul>
 * String literals are never touched. Any malformed reference fails the whole rewrite.
 */
public class ReferencePreprocessor {

    private final FormulaLexer lexer = new FormulaLexer();

    public String preprocess(String rawFormula) {
        return preprocess(rawFormula, null);
    }

    /**
     * @param rawFormula formula text without the leading '='
     * @param context    the cell holding the formula, or null when unknown (ROW()/COL() are then left as written)
     */
    public String preprocess(String rawFormula, CellRef context) {
        List<FormulaToken> tokens = lexer.tokenize(rawFormula);
        StringBuilder out = new StringBuilder(rawFormula.length() + 16);
        rewrite(rawFormula, tokens, 0, tokens.size(), context, out);
        return out.toString();
    }

    private void rewrite(String formula, List<FormulaToken> tokens, int from, int to,
                         CellRef context, StringBuilder out) {
        int i = from;
        while (i < to) {
            FormulaToken token = tokens.get(i);
            if (token.is(FormulaTokenType.AT)) {
                if (i + 1 >= to || !FormulaTokens.isReferenceWord(tokens, i + 1)) {
                    throw new FormulaParseException("Expected a cell reference after '@'", formula,
                            token.getStart(), Math.min(formula.length(), token.getEnd() + 1));
                }
                CellRef ref = reference(formula, tokens, i + 1, to);
                out.append("VALUE(").append(ref.getCol()).append(", ").append(ref.getRow()).append(')');
                i += 2;
            } else if (FormulaTokens.isCallName(tokens, i) && RangeFunction.fromName(token.getText()) != null) {
                i = rewriteRangeCall(formula, tokens, i, to, context, out);
            } else if (context != null && isPositionCall(tokens, i, to)) {
                int value = token.getText().equals("ROW") ? context.getRow() + 1 : context.getCol() + 1;
                out.append(value);
                i += 3;
            } else if (FormulaTokens.isReferenceWord(tokens, i)) {
                CellRef ref = reference(formula, tokens, i, to);
                out.append("CELL(").append(ref.getCol()).append(", ").append(ref.getRow()).append(')');
                i++;
            } else {
                out.append(token.getText());
                i++;
            }
        }
    }

    private int rewriteRangeCall(String formula, List<FormulaToken> tokens, int nameIndex, int to,
                                 CellRef context, StringBuilder out) {
        FormulaToken name = tokens.get(nameIndex);
        RangeFunction function = RangeFunction.fromName(name.getText());
        int close = FormulaTokens.findClosingParen(tokens, nameIndex + 1, to);
        if (close < 0) {
            throw new FormulaParseException("Unmatched parenthesis in " + name.getText() + " call",
                    formula, name.getStart(), formula.length());
        }
        List<int[]> arguments = FormulaTokens.splitArguments(tokens, nameIndex + 2, close);
        for (int k = 0; k < function.getRangeArgumentCount(); k++) {
            int position = function.getRangeArgument(k);
            if (position >= arguments.size()) {
                throw new FormulaParseException(name.getText() + " expects a range as argument " + (position + 1),
                        formula, name.getStart(), tokens.get(close).getEnd());
            }
        }

        List<String> rewritten = new ArrayList<>(arguments.size());
        for (int index = 0; index < arguments.size(); index++) {
            int[] span = arguments.get(index);
            if (function.isRangeArgument(index)) {
                rewritten.add(rangeCoordinates(formula, tokens, span, name.getText(), index));
            } else {
                StringBuilder argument = new StringBuilder();
                rewrite(formula, tokens, span[0], span[1], context, argument);
                rewritten.add(argument.toString());
            }
        }
        out.append(function.getRuntimeName()).append('(').append(String.join(", ", rewritten)).append(')');
        return close + 1;
    }

    private String rangeCoordinates(String formula, List<FormulaToken> tokens, int[] span,
                                    String functionName, int index) {
        boolean shaped = span[1] - span[0] == 3
                && FormulaTokens.isReferenceWord(tokens, span[0])
                && tokens.get(span[0] + 1).is(FormulaTokenType.COLON)
                && FormulaTokens.isReferenceWord(tokens, span[0] + 2);
        if (!shaped) {
            int start = span[0] < span[1] ? tokens.get(span[0]).getStart() : 0;
            int end = span[0] < span[1] ? tokens.get(span[1] - 1).getEnd() : formula.length();
            throw new FormulaParseException(functionName + " expects a range as argument " + (index + 1),
                    formula, start, end);
        }
        CellRef first = parseReference(formula, tokens.get(span[0]));
        CellRef second = parseReference(formula, tokens.get(span[0] + 2));
        return first.getCol() + ", " + first.getRow() + ", " + second.getCol() + ", " + second.getRow();
    }

    /**
     * Parses the reference at i and rejects a range that starts there, since ranges are
     * only valid as declared range-function arguments.
     */
    private CellRef reference(String formula, List<FormulaToken> tokens, int i, int to) {
        FormulaToken token = tokens.get(i);
        CellRef ref = parseReference(formula, token);
        if (i + 1 < to && tokens.get(i + 1).is(FormulaTokenType.COLON)) {
            if (i + 2 >= to) {
                throw new FormulaParseException("Incomplete range", formula,
                        token.getStart(), tokens.get(i + 1).getEnd());
            }
            FormulaToken after = tokens.get(i + 2);
            if (FormulaTokens.isReferenceWord(tokens, i + 2)) {
                throw new FormulaParseException("Range is only allowed as a range function argument",
                        formula, token.getStart(), after.getEnd());
            }
            if (after.is(FormulaTokenType.WORD)) {
                throw new FormulaParseException("Incomplete range", formula, token.getStart(), after.getEnd());
            }
        }
        return ref;
    }

    private static CellRef parseReference(String formula, FormulaToken token) {
        CellRef ref = CellRef.parse(token.getText());
        if (ref == null) {
            throw new FormulaParseException("Invalid cell reference", formula, token.getStart(), token.getEnd());
        }
        return ref;
    }

    private static boolean isPositionCall(List<FormulaToken> tokens, int i, int to) {
        if (i + 2 >= to || !FormulaTokens.isCallName(tokens, i)) {
            return false;
        }
        String name = tokens.get(i).getText();
        return (name.equals("ROW") || name.equals("COL")) && tokens.get(i + 2).is(FormulaTokenType.RPAREN);
    }
}
