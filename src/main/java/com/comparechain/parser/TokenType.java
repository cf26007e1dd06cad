package com.comparechain.parser;

/**
 * Token types for expression parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,

    // Logical operators
    AND,
    OR,
    NOT,

    // Ordering operators
    LT,
    GT,
    LTE,
    GTE,

    // Equality operators
    EQ,
    NE,
    STRICT_EQ,
    STRICT_NE,

    // Nested compare request
    COMPARE,

    // Special
    EOF
}
