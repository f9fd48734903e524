package com.boolexpr.exception;

/**
 * Exception thrown when a rule set configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends BoolExprException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
