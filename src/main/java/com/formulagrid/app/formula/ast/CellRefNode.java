package com.formulagrid.app.formula.ast;

import com.formulagrid.app.references.CellAddress;

/**
 * Reference to a single cell, e.g. A1 or $B$2.
 */
public final class CellRefNode implements Node {

    private final CellAddress address;
    private final boolean absoluteColumn;
    private final boolean absoluteRow;

    public CellRefNode(CellAddress address, boolean absoluteColumn, boolean absoluteRow) {
        this.address = address;
        this.absoluteColumn = absoluteColumn;
        this.absoluteRow = absoluteRow;
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isAbsoluteColumn() {
        return absoluteColumn;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    @Override
    public String toString() {
        return address.toA1();
    }
}
