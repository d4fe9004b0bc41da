package com.loglens.core.expression;

/**
 * Raised when an expression cannot be tokenized or parsed.
 */
public class InvalidExpressionException extends Exception {

    private static final long serialVersionUID = 1L;

    public InvalidExpressionException(String message) {
        super(message);
    }

    public InvalidExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
