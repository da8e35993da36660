package com.formulagrid.app.references;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based (row, col) position of a cell.
 * Ordered row-major, so sorted collections of addresses iterate the way a sheet reads.
 */
public final class CellAddress implements Comparable<CellAddress> {

    // "$A$1", "a1", "CV100": optional absolute markers, letters, 1-based row
    public static final Pattern A1_PATTERN = Pattern.compile("^(\\$?)([A-Za-z]+)(\\$?)([0-9]+)$");

    private final int row;
    private final int col;

    public CellAddress(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Negative cell address: (" + row + "," + col + ")");
        }
        this.row = row;
        this.col = col;
    }

    /**
     * Parses A1 notation. Absolute markers are accepted and ignored.
     * Throws IllegalArgumentException for anything that is not an address.
     */
    public static CellAddress parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Address must not be null");
        }
        Matcher matcher = A1_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a cell address: " + text);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(4)) - 1;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Row out of range: " + text);
        }
        if (row < 0) {
            throw new IllegalArgumentException("Rows start at 1: " + text);
        }
        return new CellAddress(row, ColumnLetters.toIndex(matcher.group(2)));
    }

    public static boolean isAddress(String text) {
        if (text == null) {
            return false;
        }
        try {
            parse(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public CellAddress withRow(int newRow) {
        return new CellAddress(newRow, col);
    }

    public CellAddress withCol(int newCol) {
        return new CellAddress(row, newCol);
    }

    /**
     * A1 notation, e.g. (0,0) -> "A1".
     */
    public String toA1() {
        return ColumnLetters.toLetters(col) + (row + 1);
    }

    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return toA1();
    }
}
