package com.formulagrid.app.commands;

import com.formulagrid.app.models.Grid;
import com.formulagrid.app.references.CellAddress;

/**
 * The dimension a structural edit works along.
 */
public enum Axis {
    ROWS("Rows"),
    COLUMNS("Columns");

    private final String label;

    Axis(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public int indexOf(CellAddress address) {
        return this == ROWS ? address.getRow() : address.getCol();
    }

    public CellAddress withIndex(CellAddress address, int index) {
        return this == ROWS ? address.withRow(index) : address.withCol(index);
    }

    public int size(Grid grid) {
        return this == ROWS ? grid.getRowCount() : grid.getColumnCount();
    }

    public void resize(Grid grid, int delta) {
        if (this == ROWS) {
            grid.adjustRowCount(delta);
        } else {
            grid.adjustColumnCount(delta);
        }
    }
}
