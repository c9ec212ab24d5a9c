package com.gridline.app.formula;

import com.gridline.app.models.Cell;
import com.gridline.app.models.CellRef;

import java.util.regex.Pattern;

/**
 * Classifies user or file input into a cell:
 * blank -> empty, "=..." -> formula, "\"...\"" -> text, TRUE/FALSE -> bool,
 * numeric literal -> number, anything else -> text.
 */
public class CellInputParser {

    private static final Pattern NUMBER = Pattern.compile(
            "^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$|^[+-]?(NaN|Infinity)$");

    private final ReferencePreprocessor preprocessor;

    public CellInputParser(ReferencePreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    /**
     * @param input the text as typed
     * @param at    the cell being written, used for position-dependent rewrites
     * @throws com.gridline.app.exceptions.FormulaParseException if a formula has malformed references
     */
    public Cell parse(String input, CellRef at) {
        if (input == null) {
            return Cell.empty();
        }
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return Cell.empty();
        }
        if (trimmed.startsWith("=")) {
            String raw = trimmed.substring(1).trim();
            return Cell.formula(raw, preprocessor.preprocess(raw, at));
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return Cell.text(unquote(trimmed));
        }
        if (trimmed.equalsIgnoreCase("TRUE") || trimmed.equalsIgnoreCase("FALSE")) {
            return Cell.bool(trimmed.equalsIgnoreCase("TRUE"));
        }
        if (NUMBER.matcher(trimmed).matches()) {
            return Cell.number(Double.parseDouble(trimmed));
        }
        return Cell.text(trimmed);
    }

    /**
     * Quotes text so that {@link #parse} reads it back as the same text cell.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Strips the surrounding quotes and resolves \\, \" and \n.
     */
    public static String unquote(String quoted) {
        String body = quoted.substring(1, quoted.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                sb.append(next == 'n' ? '\n' : next);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
