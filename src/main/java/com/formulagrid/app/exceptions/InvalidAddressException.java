package com.formulagrid.app.exceptions;

/**
 * Thrown when a cell address is malformed ("1A", "") or lies
 * outside the current grid dimensions.
 */
public class InvalidAddressException extends RuntimeException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
