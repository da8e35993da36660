package com.formulagrid.app.formula;

/**
 * Thrown by the tokenizer and parser for malformed formula text.
 * The evaluator turns it into the #PARSE! sentinel; it never leaves the engine.
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " (at " + position + ")");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
