package com.boolexpr.expression;

/**
 * Token types for expression parsing.
 */
public enum TokenType {
    // Terminals
    NUMBER,
    STRING,
    VARIABLE,

    // Comparison operators
    GT,
    GTE,
    LT,
    LTE,
    EQ,
    NEQ,
    STRING_PREFIX,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,

    // Fragment matching none of the terminal shapes; rejected by the parser when consumed
    UNRECOGNIZED,

    // Special
    EOF
}
