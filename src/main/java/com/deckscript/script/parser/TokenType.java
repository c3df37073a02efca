package com.deckscript.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens
    BANG, BANG_EQUAL,
    EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    NUMBER, STRING, TEMPLATE,

    // Identifier paths (a.b[0]) and whole helper calls (evenX(0, 3))
    IDENTIFIER, CALL,

    // Keywords
    TRUE, FALSE, NULL, UNDEFINED,

    EOF
}
