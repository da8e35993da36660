package com.formulagrid.app.commands;

import com.formulagrid.app.exceptions.InvalidStructuralEditException;
import com.formulagrid.app.models.Grid;

/**
 * Inserts {@code count} empty rows or columns before {@code position}; position == size appends.
 */
public abstract class InsertCommand extends StructuralEditCommand {

    protected InsertCommand(Grid grid, Axis axis, int position, int count) {
        super(grid, axis, position, count);
        int size = axis.size(grid);
        if (position < 0 || position > size) {
            throw new InvalidStructuralEditException("Insert position " + position
                    + " outside [0, " + size + "]");
        }
        if ((long) size + count > Integer.MAX_VALUE) {
            throw new InvalidStructuralEditException("Cannot insert " + count + " " + axis.getLabel()
                    + " into " + size + ": the grid would exceed " + Integer.MAX_VALUE);
        }
    }

    @Override
    public void redo() {
        shift(position, count);
        axis.resize(grid, count);
    }

    @Override
    public void undo() {
        shift(position + count, -count);
        axis.resize(grid, -count);
    }

    @Override
    public String getText() {
        return "Insert " + count + " " + axis.getLabel();
    }
}
