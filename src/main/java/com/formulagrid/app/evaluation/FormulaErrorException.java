package com.formulagrid.app.evaluation;

/**
 * Carries an error kind out of deep evaluation code (reference expansion, type coercion).
 * The evaluator converts it to the sentinel at the nearest argument or formula boundary.
 */
public class FormulaErrorException extends RuntimeException {

    private final FormulaError error;

    public FormulaErrorException(FormulaError error, String message) {
        super(message);
        this.error = error;
    }

    public FormulaError getError() {
        return error;
    }

    public String getSentinel() {
        return error.sentinel();
    }
}
