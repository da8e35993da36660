package com.formulagrid.app.exceptions;

/**
 * Thrown when attempting to access a grid ID
 * that doesn't exist in the in-memory store.
 */
public class GridNotFoundException extends RuntimeException {
    public GridNotFoundException(String message) {
        super(message);
    }
}
