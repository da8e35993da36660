package com.formulagrid.app.formula;

/**
 * A lexical token with its position in the formula body.
 * For STRING tokens {@code text} holds the contents without quotes.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;

    public Token(TokenType type, String text, int start, int end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /** Offset of the first character, inclusive. */
    public int getStart() {
        return start;
    }

    /** Offset after the last character. */
    public int getEnd() {
        return end;
    }

    public boolean is(TokenType expected, String value) {
        return type == expected && text.equals(value);
    }

    @Override
    public String toString() {
        return "Token(" + type + ", '" + text + "')";
    }
}
