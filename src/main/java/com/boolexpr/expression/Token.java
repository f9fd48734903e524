package com.boolexpr.expression;

/**
 * Represents a token in an expression.
 *
 * @param type     Token type
 * @param text     Original text, trimmed
 * @param literal  Parsed literal value (Double for numbers, unquoted content for strings)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
