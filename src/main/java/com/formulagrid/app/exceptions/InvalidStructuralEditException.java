package com.formulagrid.app.exceptions;

/**
 * Thrown when a row/column insert or remove has a bad position or count,
 * e.g. removing 3 rows starting at the last row.
 */
public class InvalidStructuralEditException extends RuntimeException {
    public InvalidStructuralEditException(String message) {
        super(message);
    }
}
