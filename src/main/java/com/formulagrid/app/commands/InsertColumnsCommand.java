package com.formulagrid.app.commands;

import com.formulagrid.app.models.Grid;

/**
 * Inserts empty columns before {@code position}.
 */
public class InsertColumnsCommand extends InsertCommand {

    public InsertColumnsCommand(Grid grid, int position, int count) {
        super(grid, Axis.COLUMNS, position, count);
    }
}
