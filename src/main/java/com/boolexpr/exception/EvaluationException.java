package com.boolexpr.exception;

/**
 * Exception thrown when an operator is applied to values it cannot handle,
 * e.g. ordering a string against a number.
 * Fatal to a single evaluation only; the compiled expression stays usable.
 */
public class EvaluationException extends BoolExprException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
