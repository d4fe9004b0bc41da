package com.loglens.core.expression.grammar;

import com.loglens.core.model.LogEvent;

import java.io.Serializable;

/**
 * Node of a parsed expression tree.
 *
 * <p>
 * Evaluation yields one of: {@code null} (None), {@link Boolean},
 * {@link Number}, {@link String}, {@link java.util.List} or
 * {@link java.util.Map} (nested metadata).
 * </p>
 */
public interface ExpressionNode extends Serializable {

    /**
     * @param event event the expression is evaluated against
     * @return the node's value
     * @throws com.loglens.core.expression.ExpressionEvaluationException if the
     *         operands are of incompatible types for this event
     */
    Object evaluate(LogEvent event);
}
