package com.formulagrid.app.references;

/**
 * Inclusive rectangle between two corners. Corners are normalized on construction,
 * so "C3:A1" and "A1:C3" describe the same range.
 */
public final class RangeAddress {

    private final CellAddress topLeft;
    private final CellAddress bottomRight;

    public RangeAddress(CellAddress first, CellAddress second) {
        this.topLeft = new CellAddress(Math.min(first.getRow(), second.getRow()),
                Math.min(first.getCol(), second.getCol()));
        this.bottomRight = new CellAddress(Math.max(first.getRow(), second.getRow()),
                Math.max(first.getCol(), second.getCol()));
    }

    public CellAddress getTopLeft() {
        return topLeft;
    }

    public CellAddress getBottomRight() {
        return bottomRight;
    }

    public int getRowCount() {
        return bottomRight.getRow() - topLeft.getRow() + 1;
    }

    public int getColumnCount() {
        return bottomRight.getCol() - topLeft.getCol() + 1;
    }

    // long: a full-sheet range overflows int
    public long getCellCount() {
        return (long) getRowCount() * getColumnCount();
    }

    @Override
    public String toString() {
        return topLeft.toA1() + ":" + bottomRight.toA1();
    }
}
