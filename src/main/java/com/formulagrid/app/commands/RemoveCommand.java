package com.formulagrid.app.commands;

import com.formulagrid.app.exceptions.InvalidStructuralEditException;
import com.formulagrid.app.models.Grid;

import java.util.Collections;
import java.util.List;

/**
 * Removes {@code count} rows or columns starting at {@code position}.
 * The removed entries of every store are kept so undo can put them back.
 */
public abstract class RemoveCommand extends StructuralEditCommand {

    private List<CapturedBand<?>> removed = Collections.emptyList();

    protected RemoveCommand(Grid grid, Axis axis, int position, int count) {
        super(grid, axis, position, count);
        int size = axis.size(grid);
        if (position < 0 || (long) position + count > size) {
            throw new InvalidStructuralEditException("Cannot remove " + count + " " + axis.getLabel()
                    + " at " + position + " from " + size);
        }
    }

    @Override
    public void redo() {
        removed = captureBand(position, position + count);
        shift(position + count, -count);
        axis.resize(grid, -count);
    }

    @Override
    public void undo() {
        axis.resize(grid, count);
        shift(position, count);
        for (CapturedBand<?> band : removed) {
            band.restore();
        }
        removed = Collections.emptyList();
    }

    @Override
    public String getText() {
        return "Remove " + count + " " + axis.getLabel();
    }
}
