package com.formulagrid.app.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Linear undo/redo history of one grid.
 *
 * Pushing a command runs it and clears the redo stack. When more than
 * {@code undoLimit} commands are recorded the oldest one is dropped.
 */
public class CommandHistory {

    private static final Logger log = LoggerFactory.getLogger(CommandHistory.class);

    public static final int DEFAULT_UNDO_LIMIT = 100;

    private final Deque<GridCommand> undoStack = new ArrayDeque<>();
    private final Deque<GridCommand> redoStack = new ArrayDeque<>();
    private int undoLimit;

    public CommandHistory() {
        this(DEFAULT_UNDO_LIMIT);
    }

    public CommandHistory(int undoLimit) {
        setUndoLimit(undoLimit);
    }

    /**
     * Runs the command and records it. A command that throws from redo() is not recorded.
     */
    public void push(GridCommand command) {
        command.redo();
        undoStack.push(command);
        redoStack.clear();
        while (undoStack.size() > undoLimit) {
            undoStack.removeLast();
        }
        log.debug("Applied '{}'", command.getText());
    }

    /** @return false when there is nothing to undo */
    public boolean undo() {
        GridCommand command = undoStack.peek();
        if (command == null) {
            return false;
        }
        command.undo();
        // Only dropped from the stack once it ran, so a failing command stays where it was
        undoStack.pop();
        redoStack.push(command);
        log.debug("Undid '{}'", command.getText());
        return true;
    }

    /** @return false when there is nothing to redo */
    public boolean redo() {
        GridCommand command = redoStack.peek();
        if (command == null) {
            return false;
        }
        command.redo();
        redoStack.pop();
        undoStack.push(command);
        log.debug("Redid '{}'", command.getText());
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public String getUndoText() {
        return undoStack.isEmpty() ? null : undoStack.peek().getText();
    }

    public String getRedoText() {
        return redoStack.isEmpty() ? null : redoStack.peek().getText();
    }

    public int getUndoLimit() {
        return undoLimit;
    }

    public void setUndoLimit(int undoLimit) {
        if (undoLimit < 1) {
            throw new IllegalArgumentException("Undo limit must be at least 1");
        }
        this.undoLimit = undoLimit;
        while (undoStack.size() > undoLimit) {
            undoStack.removeLast();
        }
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
