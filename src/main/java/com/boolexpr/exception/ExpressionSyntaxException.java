package com.boolexpr.exception;

/**
 * Exception thrown when an expression violates the grammar.
 * Raised while the expression is compiled; no partial tree is ever returned.
 */
public class ExpressionSyntaxException extends BoolExprException {

    private final String expression;
    private final int position;

    public ExpressionSyntaxException(String detail, String expression, int position) {
        super("Invalid expression at position " + position + ": " + detail + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    /**
     * Get the source text that failed to parse.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * Get the zero-based offset at which parsing failed.
     */
    public int getPosition() {
        return position;
    }
}
