package com.formulagrid.app.commands;

import com.formulagrid.app.models.Grid;
import com.formulagrid.app.references.CellAddress;

/**
 * Replaces the raw text of one cell. Empty text clears it.
 */
public class SetCellCommand implements GridCommand {

    private final Grid grid;
    private final CellAddress address;
    private final String raw;
    private String previous = "";

    public SetCellCommand(Grid grid, CellAddress address, String raw) {
        this.grid = grid;
        this.address = address;
        this.raw = raw == null ? "" : raw;
    }

    @Override
    public void redo() {
        previous = grid.setCellRaw(address, raw);
    }

    @Override
    public void undo() {
        grid.setCellRaw(address, previous);
    }

    @Override
    public String getText() {
        return "Edit Cell " + address;
    }
}
