package com.formulagrid.app.formula;

public enum TokenType {
    NUMBER,
    STRING,
    IDENTIFIER,   // cell reference, function name or TRUE/FALSE
    OPERATOR,     // + - * / ^ & = <> < > <= >= :
    LPAREN,
    RPAREN,
    COMMA,
    EOF
}
