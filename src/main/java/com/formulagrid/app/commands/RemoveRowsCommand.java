package com.formulagrid.app.commands;

import com.formulagrid.app.models.Grid;

/**
 * Removes {@code count} rows starting at {@code position}.
 */
public class RemoveRowsCommand extends RemoveCommand {

    public RemoveRowsCommand(Grid grid, int position, int count) {
        super(grid, Axis.ROWS, position, count);
    }
}
