package com.gridline.app.formula;

/**
 * Token classes produced by {@link FormulaLexer}.
 */
public enum FormulaTokenType {
    STRING,
    WORD,
    NUMBER,
    WHITESPACE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    AT,
    DOT,
    SYMBOL
}
