package com.gridline.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based (row, column) address of a cell.
 * Ordered by row first, then column, which is also the tie-break order
 * used when several evaluation orders are valid.
 * Displayed as letters + one-based row, e.g. row=9, col=0 -> "A10".
 */
public final class CellRef implements Comparable<CellRef> {

    private static final Pattern A1_PATTERN = Pattern.compile("^([A-Za-z]+)([0-9]+)$");

    private final int row;
    private final int col;

    public CellRef(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: " + row + "," + col);
        }
        this.row = row;
        this.col = col;
    }

    public static CellRef of(int row, int col) {
        return new CellRef(row, col);
    }

    /**
     * Parses spreadsheet notation ("B3", "aa10").
     * Returns null when the text is not a valid address (bad shape, row 0, overflow).
     */
    public static CellRef parse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = A1_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        long colAcc = 0;
        for (char c : matcher.group(1).toUpperCase().toCharArray()) {
            colAcc = colAcc * 26 + (c - 'A' + 1);
            if (colAcc - 1 > Integer.MAX_VALUE) {
                return null;
            }
        }
        String digits = matcher.group(2);
        if (digits.length() > 10) {
            return null;
        }
        long row = Long.parseLong(digits) - 1;
        if (row < 0 || row > Integer.MAX_VALUE) {
            return null;
        }
        return new CellRef((int) row, (int) (colAcc - 1));
    }

    /**
     * Converts a column index to letters: 0 -> A, 25 -> Z, 26 -> AA.
     */
    public static String columnToLetters(int col) {
        StringBuilder sb = new StringBuilder();
        long n = (long) col + 1;
        while (n > 0) {
            n -= 1;
            sb.insert(0, (char) ('A' + (n % 26)));
            n /= 26;
        }
        return sb.toString();
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public CellRef offset(int rowDelta, int colDelta) {
        return new CellRef(row + rowDelta, col + colDelta);
    }

    @Override
    public int compareTo(CellRef other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef other = (CellRef) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @JsonValue
    @Override
    public String toString() {
        return columnToLetters(col) + (row + 1);
    }
}
