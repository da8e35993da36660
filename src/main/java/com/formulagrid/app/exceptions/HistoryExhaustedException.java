package com.formulagrid.app.exceptions;

/**
 * Thrown when undo or redo is requested but the history has nothing left in that direction.
 */
public class HistoryExhaustedException extends RuntimeException {
    public HistoryExhaustedException(String message) {
        super(message);
    }
}
