package com.formulagrid.app.commands;

import com.formulagrid.app.models.CellStyle;
import com.formulagrid.app.models.Grid;
import com.formulagrid.app.references.CellAddress;

/**
 * Replaces the style of one cell; a null style clears it.
 */
public class SetStyleCommand implements GridCommand {

    private final Grid grid;
    private final CellAddress address;
    private final CellStyle style;
    private CellStyle previous;

    public SetStyleCommand(Grid grid, CellAddress address, CellStyle style) {
        this.grid = grid;
        this.address = address;
        this.style = style;
    }

    @Override
    public void redo() {
        previous = grid.setStyle(address, style);
    }

    @Override
    public void undo() {
        grid.setStyle(address, previous);
    }

    @Override
    public String getText() {
        return "Style Cell " + address;
    }
}
