package com.boolexpr.exception;

/**
 * Base exception for the expression engine.
 */
public class BoolExprException extends RuntimeException {

    public BoolExprException(String message) {
        super(message);
    }

    public BoolExprException(String message, Throwable cause) {
        super(message, cause);
    }
}
