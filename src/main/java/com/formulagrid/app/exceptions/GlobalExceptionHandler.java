package com.formulagrid.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps the host's exceptions to an {@link ErrorResponse} with a 4xx status.
 * Anything unexpected becomes a logged 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GridNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleGridNotFound(GridNotFoundException ex) {
        return ErrorResponse.of(HttpStatus.NOT_FOUND, "GRID_NOT_FOUND", ex);
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidAddressException ex) {
        return ErrorResponse.of(HttpStatus.BAD_REQUEST, "INVALID_ADDRESS", ex);
    }

    @ExceptionHandler(InvalidStructuralEditException.class)
    public ResponseEntity<ErrorResponse> handleInvalidEdit(InvalidStructuralEditException ex) {
        return ErrorResponse.of(HttpStatus.BAD_REQUEST, "INVALID_STRUCTURAL_EDIT", ex);
    }

    @ExceptionHandler(HistoryExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleHistoryExhausted(HistoryExhaustedException ex) {
        return ErrorResponse.of(HttpStatus.CONFLICT, "HISTORY_EXHAUSTED", ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return ErrorResponse.of(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        log.error("Unhandled exception", ex);
        return ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR", ex);
    }
}
