package com.gridline.app.formula;

import com.gridline.app.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens. Only distinguishes what reference rewriting needs:
 * string literals (kept whole, so nothing inside them is touched), identifiers, numbers,
 * and the punctuation that delimits calls and ranges. Every other character is a SYMBOL.
 */
public class FormulaLexer {

    public List<FormulaToken> tokenize(String formula) {
        List<FormulaToken> tokens = new ArrayList<>();
        int i = 0;
        int n = formula.length();
        while (i < n) {
            char c = formula.charAt(i);
            int start = i;
            if (c == '"' || c == '\'') {
                i = skipString(formula, i);
                tokens.add(new FormulaToken(FormulaTokenType.STRING, formula.substring(start, i), start, i));
            } else if (isWordStart(c)) {
                i++;
                while (i < n && isWordChar(formula.charAt(i))) {
                    i++;
                }
                tokens.add(new FormulaToken(FormulaTokenType.WORD, formula.substring(start, i), start, i));
            } else if (c >= '0' && c <= '9') {
                i = skipNumber(formula, i);
                tokens.add(new FormulaToken(FormulaTokenType.NUMBER, formula.substring(start, i), start, i));
            } else if (Character.isWhitespace(c)) {
                while (i < n && Character.isWhitespace(formula.charAt(i))) {
                    i++;
                }
                tokens.add(new FormulaToken(FormulaTokenType.WHITESPACE, formula.substring(start, i), start, i));
            } else {
                i++;
                tokens.add(new FormulaToken(punctuation(c), String.valueOf(c), start, i));
            }
        }
        return tokens;
    }

    private static boolean isWordStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static int skipString(String formula, int start) {
        char quote = formula.charAt(start);
        int i = start + 1;
        while (i < formula.length()) {
            char c = formula.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        throw new FormulaParseException("Unterminated string literal", formula, start, formula.length());
    }

    // digits, optional fraction, optional exponent; "1e5" must not leave "e5" behind as a word
    private static int skipNumber(String formula, int start) {
        int n = formula.length();
        int i = start;
        while (i < n && Character.isDigit(formula.charAt(i))) {
            i++;
        }
        if (i + 1 < n && formula.charAt(i) == '.' && Character.isDigit(formula.charAt(i + 1))) {
            i++;
            while (i < n && Character.isDigit(formula.charAt(i))) {
                i++;
            }
        }
        if (i < n && (formula.charAt(i) == 'e' || formula.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (formula.charAt(j) == '+' || formula.charAt(j) == '-')) {
                j++;
            }
            if (j < n && Character.isDigit(formula.charAt(j))) {
                while (j < n && Character.isDigit(formula.charAt(j))) {
                    j++;
                }
                i = j;
            }
        }
        return i;
    }

    private static FormulaTokenType punctuation(char c) {
        switch (c) {
            case '(':
                return FormulaTokenType.LPAREN;
            case ')':
                return FormulaTokenType.RPAREN;
            case ',':
                return FormulaTokenType.COMMA;
            case ':':
                return FormulaTokenType.COLON;
            case '@':
                return FormulaTokenType.AT;
            case '.':
                return FormulaTokenType.DOT;
            default:
                return FormulaTokenType.SYMBOL;
        }
    }
}
