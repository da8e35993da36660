package com.formulagrid.app.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * JSON body of every failed request, e.g.
 * { "status": 400, "code": "INVALID_ADDRESS", "message": "Not a cell address: 1A" }.
 * Formula errors are not reported this way; they are cell values.
 */
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String message;

    public ErrorResponse(HttpStatus status, String code, String message) {
        this.status = status.value();
        this.code = code;
        this.message = message;
    }

    static ResponseEntity<ErrorResponse> of(HttpStatus status, String code, Exception ex) {
        return new ResponseEntity<>(new ErrorResponse(status, code, ex.getMessage()), status);
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
