package com.formulagrid.app.models;

/**
 * Content of one spreadsheet cell.
 * rawValue is what the user typed: a literal like "42" or "true",
 * or a formula starting with '=' like "=SUM(A1:A3)".
 * The cell does not know its address; the grid keys it, so structural edits can move it.
 */
public class Cell {

    private final String rawValue;

    public Cell(String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            throw new IllegalArgumentException("A cell needs content; clear the address instead");
        }
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }

    public boolean isFormula() {
        return isFormula(rawValue);
    }

    public static boolean isFormula(String raw) {
        return raw != null && raw.startsWith("=");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        return rawValue.equals(((Cell) o).rawValue);
    }

    @Override
    public int hashCode() {
        return rawValue.hashCode();
    }

    @Override
    public String toString() {
        return rawValue;
    }
}
