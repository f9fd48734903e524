package com.boolexpr.exception;

/**
 * Exception thrown when the parser consumes a fragment that matched
 * none of the number, string or variable shapes.
 */
public class UnrecognizedTokenException extends ExpressionSyntaxException {

    private final String fragment;

    public UnrecognizedTokenException(String fragment, String expression, int position) {
        super("Unrecognized token '" + fragment + "'", expression, position);
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
