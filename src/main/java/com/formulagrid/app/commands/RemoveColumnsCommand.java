package com.formulagrid.app.commands;

import com.formulagrid.app.models.Grid;

/**
 * Removes {@code count} columns starting at {@code position}.
 */
public class RemoveColumnsCommand extends RemoveCommand {

    public RemoveColumnsCommand(Grid grid, int position, int count) {
        super(grid, Axis.COLUMNS, position, count);
    }
}
