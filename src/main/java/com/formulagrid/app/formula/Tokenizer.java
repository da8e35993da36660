package com.formulagrid.app.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula body (the text after '=') into tokens.
 * Whitespace is skipped; every token keeps its source offsets so callers
 * can rebuild the original text around it.
 */
public final class Tokenizer {

    private final String text;
    private int pos;

    private Tokenizer(String text) {
        this.text = text;
    }

    public static List<Token> tokenize(String text) {
        return new Tokenizer(text).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length()
                    && Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (c == '"' || c == '\'') {
                tokens.add(readString(c));
            } else if (isIdentifierStart(c)) {
                tokens.add(readIdentifier());
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", pos, ++pos));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", pos, ++pos));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", pos, ++pos));
            } else {
                tokens.add(readOperator());
            }
        }
        tokens.add(new Token(TokenType.EOF, "", pos, pos));
        return tokens;
    }

    private Token readNumber() {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        // exponent only when digits follow, so "1E" stays an error instead of a silent 1
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, text.substring(start, pos), start, pos);
    }

    private Token readString(char quote) {
        int start = pos;
        int close = text.indexOf(quote, pos + 1);
        if (close < 0) {
            throw new FormulaParseException("Unterminated string", start);
        }
        pos = close + 1;
        return new Token(TokenType.STRING, text.substring(start + 1, close), start, pos);
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return new Token(TokenType.IDENTIFIER, text.substring(start, pos), start, pos);
    }

    private Token readOperator() {
        int start = pos;
        char c = text.charAt(pos);
        if (pos + 1 < text.length()) {
            String pair = text.substring(pos, pos + 2);
            if (pair.equals("<=") || pair.equals(">=") || pair.equals("<>")) {
                pos += 2;
                return new Token(TokenType.OPERATOR, pair, start, pos);
            }
        }
        if ("+-*/^&=<>:".indexOf(c) >= 0) {
            pos++;
            return new Token(TokenType.OPERATOR, String.valueOf(c), start, pos);
        }
        throw new FormulaParseException("Unexpected character '" + c + "'", start);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || (c < 128 && Character.isLetter(c));
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c) || c == '.';
    }
}
