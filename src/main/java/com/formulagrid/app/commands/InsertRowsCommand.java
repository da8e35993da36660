package com.formulagrid.app.commands;

import com.formulagrid.app.models.Grid;

/**
 * Inserts empty rows before {@code position}.
 */
public class InsertRowsCommand extends InsertCommand {

    public InsertRowsCommand(Grid grid, int position, int count) {
        super(grid, Axis.ROWS, position, count);
    }
}
