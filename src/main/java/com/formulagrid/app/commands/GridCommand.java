package com.formulagrid.app.commands;

/**
 * A reversible edit of a grid. {@code redo()} followed by {@code undo()} must leave
 * the grid exactly as it was.
 */
public interface GridCommand {

    void redo();

    void undo();

    /** Short label for menus and logs, e.g. "Insert 2 Rows". */
    String getText();
}
