package com.gridline.app.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers over token lists shared by the preprocessor, the reference shifter
 * and edge extraction.
 */
public final class FormulaTokens {

    private static final Pattern REFERENCE_SHAPE = Pattern.compile("^[A-Za-z]+[0-9]+$");

    private FormulaTokens() {
    }

    /**
     * True when token i is a word shaped like a cell reference in a position where it
     * means one: not a member access ({@code x.A1}), not {@code #A1}, not a call {@code A1(}.
     */
    public static boolean isReferenceWord(List<FormulaToken> tokens, int i) {
        if (i < 0 || i >= tokens.size()) {
            return false;
        }
        FormulaToken token = tokens.get(i);
        if (!token.is(FormulaTokenType.WORD) || !REFERENCE_SHAPE.matcher(token.getText()).matches()) {
            return false;
        }
        if (i > 0) {
            FormulaToken previous = tokens.get(i - 1);
            if (previous.is(FormulaTokenType.DOT)
                    || (previous.is(FormulaTokenType.SYMBOL) && previous.getText().equals("#"))) {
                return false;
            }
        }
        return !isCallName(tokens, i);
    }

    /**
     * True when token i is a word immediately followed by '(' and not a member call.
     */
    public static boolean isCallName(List<FormulaToken> tokens, int i) {
        if (i + 1 >= tokens.size() || !tokens.get(i).is(FormulaTokenType.WORD)
                || !tokens.get(i + 1).is(FormulaTokenType.LPAREN)) {
            return false;
        }
        return i == 0 || !tokens.get(i - 1).is(FormulaTokenType.DOT);
    }

    /**
     * Index of the ')' matching the '(' at openIndex, or -1 if unbalanced before limit.
     */
    public static int findClosingParen(List<FormulaToken> tokens, int openIndex, int limit) {
        int depth = 0;
        for (int i = openIndex; i < limit; i++) {
            FormulaTokenType type = tokens.get(i).getType();
            if (type == FormulaTokenType.LPAREN) {
                depth++;
            } else if (type == FormulaTokenType.RPAREN) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits tokens [from, to) at top-level commas. Each argument is returned as a
     * half-open {start, end} token span with surrounding whitespace trimmed.
     * An empty argument list yields no spans.
     */
    public static List<int[]> splitArguments(List<FormulaToken> tokens, int from, int to) {
        List<int[]> arguments = new ArrayList<>();
        if (trimStart(tokens, from, to) == to) {
            return arguments;
        }
        int depth = 0;
        int argStart = from;
        for (int i = from; i < to; i++) {
            FormulaTokenType type = tokens.get(i).getType();
            if (type == FormulaTokenType.LPAREN) {
                depth++;
            } else if (type == FormulaTokenType.RPAREN) {
                depth--;
            } else if (type == FormulaTokenType.COMMA && depth == 0) {
                arguments.add(trim(tokens, argStart, i));
                argStart = i + 1;
            }
        }
        arguments.add(trim(tokens, argStart, to));
        return arguments;
    }

    private static int[] trim(List<FormulaToken> tokens, int from, int to) {
        int start = trimStart(tokens, from, to);
        int end = to;
        while (end > start && tokens.get(end - 1).is(FormulaTokenType.WHITESPACE)) {
            end--;
        }
        return new int[] {start, end};
    }

    private static int trimStart(List<FormulaToken> tokens, int from, int to) {
        int start = from;
        while (start < to && tokens.get(start).is(FormulaTokenType.WHITESPACE)) {
            start++;
        }
        return start;
    }
}
