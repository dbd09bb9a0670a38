package com.soorj.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, SEMICOLON, PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens.
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Literals.
    IDENTIFIER, STRING, NUMBER,

    // Keywords.
    IF, ELSE, WHILE, FUNCTION, RETURN, TRUE, FALSE, NULL, AND, OR, NOT,

    EOF
}
