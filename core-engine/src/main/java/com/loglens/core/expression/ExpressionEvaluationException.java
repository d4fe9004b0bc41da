package com.loglens.core.expression;

/**
 * Raised when a well-formed expression cannot be evaluated against a
 * particular event, e.g. ordering a string against a number or extracting a
 * value from a missing metadata key.
 */
public class ExpressionEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvaluationException(String message) {
        super(message);
    }

    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
